package app.chatarchive.config;

import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

import app.chatarchive.content.ContentNormalizer;
import app.chatarchive.content.TimestampFormatter;
import app.chatarchive.conversation.ConversationBuilder;
import app.chatarchive.conversation.ConversationParser;
import app.chatarchive.conversation.ProjectGrouper;
import app.chatarchive.conversation.TitleDeriver;
import app.chatarchive.export.ExportRecordDecoder;
import app.chatarchive.graph.GraphParser;
import app.chatarchive.graph.Linearizer;
import app.chatarchive.markdown.MarkdownBundleWriter;
import app.chatarchive.markdown.MarkdownRenderer;

/**
 * Wires the parsing core. The core classes carry no Spring annotations and no shared state.
 */
@Configuration
@EnableConfigurationProperties(ArchiveProperties.class)
public class ArchiveConfiguration {

    @Bean
    public TimestampFormatter timestampFormatter(ArchiveProperties properties) {
        return new TimestampFormatter(properties.timeZone());
    }

    @Bean
    public GraphParser graphParser() {
        return new GraphParser();
    }

    @Bean
    public Linearizer linearizer() {
        return new Linearizer();
    }

    @Bean
    public ContentNormalizer contentNormalizer() {
        return new ContentNormalizer();
    }

    @Bean
    public TitleDeriver titleDeriver(ArchiveProperties properties) {
        return new TitleDeriver(properties.titleMaxLength());
    }

    @Bean
    public ConversationBuilder conversationBuilder(GraphParser graphParser,
                                                   Linearizer linearizer,
                                                   ContentNormalizer contentNormalizer,
                                                   TitleDeriver titleDeriver) {
        return new ConversationBuilder(graphParser, linearizer, contentNormalizer, titleDeriver);
    }

    @Bean
    public ConversationParser conversationParser(ConversationBuilder conversationBuilder,
                                                 @Qualifier(ParseExecutorConfig.PARSE_EXECUTOR) Executor executor) {
        return new ConversationParser(conversationBuilder, executor);
    }

    @Bean
    public ProjectGrouper projectGrouper() {
        return new ProjectGrouper();
    }

    @Bean
    public ExportRecordDecoder exportRecordDecoder(ObjectMapper objectMapper) {
        return new ExportRecordDecoder(objectMapper);
    }

    @Bean
    public MarkdownRenderer markdownRenderer(TimestampFormatter timestampFormatter) {
        return new MarkdownRenderer(timestampFormatter);
    }

    @Bean
    public MarkdownBundleWriter markdownBundleWriter(MarkdownRenderer markdownRenderer) {
        return new MarkdownBundleWriter(markdownRenderer);
    }
}
