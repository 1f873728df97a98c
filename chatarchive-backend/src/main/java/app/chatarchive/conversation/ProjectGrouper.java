package app.chatarchive.conversation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Partitions conversations into project buckets by project id. Every conversation lands in
 * exactly one bucket; conversations without a project go to the reserved {@value #UNASSIGNED}
 * bucket, which is always present and always last. Buckets are keyed by project name (the
 * project id when no name is known); a name shared by two projects gets the id appended.
 * Within a bucket conversations are ordered most recently updated first.
 */
public class ProjectGrouper {

    public static final String UNASSIGNED = "_Unassigned_";
    public static final String UNASSIGNED_ID = "_unassigned";

    public Map<String, List<Conversation>> groupByProject(Collection<Conversation> conversations) {
        Map<String, List<Conversation>> grouped = new LinkedHashMap<>();
        for (Bucket bucket : buckets(conversations)) {
            grouped.put(bucket.name(), bucket.members());
        }
        return grouped;
    }

    public List<Project> projects(Collection<Conversation> conversations) {
        List<Project> projects = new ArrayList<>();
        for (Bucket bucket : buckets(conversations)) {
            projects.add(new Project(bucket.id(), bucket.name(),
                    bucket.members().stream().map(Conversation::getId).toList()));
        }
        return projects;
    }

    private List<Bucket> buckets(Collection<Conversation> conversations) {
        Map<String, List<Conversation>> byProjectId = new LinkedHashMap<>();
        List<Conversation> unassigned = new ArrayList<>();
        for (Conversation conversation : conversations) {
            if (conversation.hasProject()) {
                byProjectId.computeIfAbsent(conversation.getProjectId(), key -> new ArrayList<>()).add(conversation);
            } else {
                unassigned.add(conversation);
            }
        }

        List<Bucket> named = new ArrayList<>();
        for (Map.Entry<String, List<Conversation>> entry : byProjectId.entrySet()) {
            List<Conversation> members = new ArrayList<>(entry.getValue());
            members.sort(Conversation.RECENT_FIRST);
            named.add(new Bucket(entry.getKey(), projectName(entry.getKey(), members), List.copyOf(members)));
        }
        named.sort(Comparator.comparing(Bucket::name, String.CASE_INSENSITIVE_ORDER)
                .thenComparing(Bucket::name)
                .thenComparing(Bucket::id));

        Set<String> taken = new HashSet<>();
        taken.add(UNASSIGNED);
        List<Bucket> buckets = new ArrayList<>(named.size() + 1);
        for (Bucket bucket : named) {
            String name = bucket.name();
            if (!taken.add(name)) {
                name = name + " (" + bucket.id() + ")";
                taken.add(name);
            }
            buckets.add(new Bucket(bucket.id(), name, bucket.members()));
        }

        unassigned.sort(Conversation.RECENT_FIRST);
        buckets.add(new Bucket(UNASSIGNED_ID, UNASSIGNED, List.copyOf(unassigned)));
        return buckets;
    }

    private String projectName(String projectId, List<Conversation> members) {
        return members.stream()
                .map(Conversation::getProjectName)
                .filter(name -> name != null && !name.isBlank())
                .findFirst()
                .orElse(projectId);
    }

    private record Bucket(String id, String name, List<Conversation> members) {
    }
}
