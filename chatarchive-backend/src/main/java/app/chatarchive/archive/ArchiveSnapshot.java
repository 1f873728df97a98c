package app.chatarchive.archive;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import app.chatarchive.conversation.Conversation;
import app.chatarchive.conversation.ParseResult;
import app.chatarchive.conversation.Project;
import app.chatarchive.conversation.ProjectGrouper;
import app.chatarchive.conversation.SkippedConversation;
import app.chatarchive.search.SearchIndex;

/**
 * Everything derived from one loaded export. Built completely before it becomes visible and
 * never modified afterwards; a reload replaces the whole snapshot.
 */
public record ArchiveSnapshot(List<Conversation> conversations,
                              List<SkippedConversation> skipped,
                              List<Project> projects,
                              Map<String, List<Conversation>> groupedByProject,
                              SearchIndex searchIndex) {

    public ArchiveSnapshot {
        conversations = List.copyOf(conversations);
        skipped = List.copyOf(skipped);
        projects = List.copyOf(projects);
        groupedByProject = Collections.unmodifiableMap(new LinkedHashMap<>(groupedByProject));
    }

    public static ArchiveSnapshot of(ParseResult result, ProjectGrouper projectGrouper) {
        List<Conversation> ordered = result.conversations().stream()
                .sorted(Conversation.RECENT_FIRST)
                .toList();
        return new ArchiveSnapshot(
                ordered,
                result.skipped(),
                projectGrouper.projects(ordered),
                projectGrouper.groupByProject(ordered),
                SearchIndex.build(ordered)
        );
    }

    public Optional<Conversation> find(String conversationId) {
        return conversations.stream()
                .filter(conversation -> conversation.getId().equals(conversationId))
                .findFirst();
    }

    /**
     * Conversations matching {@code query}, most recently updated first, ties broken by title.
     */
    public List<Conversation> search(String query) {
        Set<String> matches = searchIndex.query(query);
        return conversations.stream()
                .filter(conversation -> matches.contains(conversation.getId()))
                .toList();
    }

    public ArchiveStats stats() {
        int unassigned = groupedByProject.getOrDefault(ProjectGrouper.UNASSIGNED, List.of()).size();
        Map<String, Long> modelsUsed = conversations.stream()
                .map(Conversation::getModel)
                .filter(model -> model != null)
                .collect(Collectors.groupingBy(Function.identity(), TreeMap::new, Collectors.counting()));
        return new ArchiveStats(
                conversations.size(),
                conversations.stream().mapToLong(conversation -> conversation.getMessages().size()).sum(),
                (int) projects.stream().filter(project -> !project.isUnassigned()).count(),
                skipped.size(),
                unassigned,
                conversations.stream().mapToLong(Conversation::wordCount).sum(),
                modelsUsed
        );
    }
}
