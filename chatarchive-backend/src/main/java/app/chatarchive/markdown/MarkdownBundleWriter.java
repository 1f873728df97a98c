package app.chatarchive.markdown;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import app.chatarchive.conversation.Conversation;
import app.chatarchive.conversation.ProjectGrouper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Lays out the markdown export bundle: one file per conversation at
 * {@code {project directory}/{slugified title}.md}. File names are unique within a directory
 * (case-insensitively); collisions get a numeric suffix. The {@value ProjectGrouper#UNASSIGNED}
 * directory is reserved for conversations without a project. Empty project buckets produce no entries.
 */
@Slf4j
@RequiredArgsConstructor
public class MarkdownBundleWriter {

    private static final String EXTENSION = ".md";

    private final MarkdownRenderer markdownRenderer;

    public Map<String, String> layout(Map<String, List<Conversation>> groupedByProject) {
        Map<String, String> files = new LinkedHashMap<>();
        Set<String> directories = new HashSet<>();
        directories.add(ProjectGrouper.UNASSIGNED.toLowerCase(Locale.ROOT));
        for (Map.Entry<String, List<Conversation>> bucket : groupedByProject.entrySet()) {
            if (bucket.getValue().isEmpty()) {
                continue;
            }
            String directory = ProjectGrouper.UNASSIGNED.equals(bucket.getKey())
                    ? ProjectGrouper.UNASSIGNED
                    : FileNames.unique(FileNames.directoryName(bucket.getKey()), directories);
            Set<String> fileNames = new HashSet<>();
            for (Conversation conversation : bucket.getValue()) {
                String fileName = FileNames.unique(FileNames.slugify(conversation.getTitle()), fileNames);
                files.put(directory + "/" + fileName + EXTENSION, markdownRenderer.render(conversation));
            }
        }
        return files;
    }

    public byte[] toZip(Map<String, List<Conversation>> groupedByProject) {
        Map<String, String> files = layout(groupedByProject);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(buffer, StandardCharsets.UTF_8)) {
            for (Map.Entry<String, String> file : files.entrySet()) {
                zip.putNextEntry(new ZipEntry(file.getKey()));
                zip.write(file.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        } catch (IOException exception) {
            throw new UncheckedIOException("Failed to write markdown bundle", exception);
        }
        log.info("Exported {} conversations to markdown bundle", files.size());
        return buffer.toByteArray();
    }
}
