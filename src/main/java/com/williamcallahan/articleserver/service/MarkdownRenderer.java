package com.williamcallahan.articleserver.service;

import com.vladsch.flexmark.ext.autolink.AutolinkExtension;
import com.vladsch.flexmark.ext.definition.DefinitionExtension;
import com.vladsch.flexmark.ext.footnotes.FootnoteExtension;
import com.vladsch.flexmark.ext.gfm.strikethrough.StrikethroughExtension;
import com.vladsch.flexmark.ext.gfm.tasklist.TaskListExtension;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.ext.wikilink.WikiLinkExtension;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import com.vladsch.flexmark.util.misc.Extension;
import com.williamcallahan.articleserver.config.AppProperties;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Renders article markdown to HTML with the extension set chosen in {@code app.markdown.*}.
 *
 * <p>Raw HTML in the source is escaped. Wiki links accept {@code [[target|title]]} when
 * {@code wikilinks-title-after-pipe} is on, otherwise {@code [[title|target]]}.</p>
 */
@Service
public class MarkdownRenderer {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownRenderer.class);

    private final Parser parser;
    private final HtmlRenderer renderer;

    /**
     * Creates a renderer configured from application properties.
     *
     * @param appProperties application configuration
     */
    @Autowired
    public MarkdownRenderer(AppProperties appProperties) {
        this(appProperties.getMarkdown());
    }

    /**
     * Creates a renderer for an explicit extension set.
     *
     * @param flags markdown extension switches
     */
    public MarkdownRenderer(AppProperties.Markdown flags) {
        List<Extension> extensions = extensionsFor(flags);
        MutableDataSet options = new MutableDataSet()
            .set(Parser.EXTENSIONS, extensions)
            .set(Parser.BLANK_LINES_IN_AST, false)
            .set(Parser.HTML_BLOCK_DEEP_PARSER, false)
            .set(Parser.INDENTED_CODE_NO_TRAILING_BLANK_LINES, true)
            .set(HtmlRenderer.ESCAPE_HTML, true)
            .set(HtmlRenderer.SUPPRESS_HTML, false)
            .set(HtmlRenderer.SOFT_BREAK, "\n")
            .set(HtmlRenderer.HARD_BREAK, "<br />\n")
            .set(HtmlRenderer.FENCED_CODE_LANGUAGE_CLASS_PREFIX, "language-")
            .set(HtmlRenderer.INDENT_SIZE, 2);

        if (flags.isTable()) {
            options.set(TablesExtension.COLUMN_SPANS, false)
                .set(TablesExtension.APPEND_MISSING_COLUMNS, true)
                .set(TablesExtension.DISCARD_EXTRA_COLUMNS, true)
                .set(TablesExtension.HEADER_SEPARATOR_COLUMN_MATCH, true);
        }
        if (wikilinksEnabled(flags)) {
            options.set(WikiLinkExtension.LINK_FIRST_SYNTAX, flags.isWikilinksTitleAfterPipe());
        }

        this.parser = Parser.builder(options).build();
        this.renderer = HtmlRenderer.builder(options).build();

        logger.info("MarkdownRenderer initialized with {} extensions", extensions.size());
    }

    /**
     * Renders markdown to HTML.
     *
     * @param markdown markdown source, {@code null} treated as empty
     * @return rendered HTML
     * @throws MarkdownProcessingException if parsing or rendering fails
     */
    public String render(String markdown) {
        if (markdown == null || markdown.isEmpty()) {
            return "";
        }
        try {
            Node document = parser.parse(markdown);
            return renderer.render(document);
        } catch (RuntimeException renderFailure) {
            throw new MarkdownProcessingException("Failed to render markdown", renderFailure);
        }
    }

    private static List<Extension> extensionsFor(AppProperties.Markdown flags) {
        List<Extension> extensions = new ArrayList<>();
        if (flags.isTable()) {
            extensions.add(TablesExtension.create());
        }
        if (flags.isStrikethrough()) {
            extensions.add(StrikethroughExtension.create());
        }
        if (flags.isTasklist()) {
            extensions.add(TaskListExtension.create());
        }
        if (flags.isAutolink()) {
            extensions.add(AutolinkExtension.create());
        }
        if (flags.isFootnotes()) {
            extensions.add(FootnoteExtension.create());
        }
        if (flags.isDescriptionLists()) {
            extensions.add(DefinitionExtension.create());
        }
        if (wikilinksEnabled(flags)) {
            extensions.add(WikiLinkExtension.create());
        }
        return extensions;
    }

    private static boolean wikilinksEnabled(AppProperties.Markdown flags) {
        return flags.isWikilinksTitleAfterPipe() || flags.isWikilinksTitleBeforePipe();
    }
}
