package com.localization.catalog.serializer;

import com.localization.catalog.model.Catalog;
import com.localization.catalog.model.CommentKind;
import com.localization.catalog.model.Entry;
import com.localization.catalog.model.PluralEntry;
import com.localization.catalog.model.PreviousMessage;
import com.localization.catalog.model.SingularEntry;
import com.localization.catalog.parser.PoEscapes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Writes a {@link Catalog} back to PO text.
 *
 * <p>Layout per entry: translator comments, extracted comments, references,
 * flags, previous message, then the keyword blocks. Every value keeps the
 * fragments it was parsed with: the first goes on the keyword line and each
 * further one on a line of its own. Obsolete entries get a {@code #~ } prefix on
 * every keyword and string line. Parsing the output yields an equal catalog.</p>
 */
public class PoSerializer {
    private static final Logger log = LoggerFactory.getLogger(PoSerializer.class);

    private static final String OBSOLETE_PREFIX = "#~ ";
    private static final String PREVIOUS_PREFIX = "#| ";

    private final ReferenceWrapper referenceWrapper;

    public PoSerializer() {
        this(new ReferenceWrapper());
    }

    public PoSerializer(ReferenceWrapper referenceWrapper) {
        this.referenceWrapper = referenceWrapper;
    }

    public String serialize(Catalog catalog) {
        StringBuilder out = new StringBuilder();

        if (catalog.hasHeaderBlock()) {
            writeHeader(out, catalog);
        }

        for (Entry entry : catalog.getEntries()) {
            if (out.length() > 0) {
                out.append('\n');
            }
            writeEntry(out, entry);
        }

        log.debug("Serialized catalog with {} entries ({} chars)", catalog.getEntries().size(), out.length());
        return out.toString();
    }

    private void writeHeader(StringBuilder out, Catalog catalog) {
        catalog.getTopComments().forEach(comment -> out.append(comment).append('\n'));
        out.append("msgid \"\"\n");
        out.append("msgstr \"\"\n");
        for (Map.Entry<String, String> header : catalog.getHeaders().entrySet()) {
            out.append(quote(header.getKey() + ": " + header.getValue() + "\n")).append('\n');
        }
    }

    private void writeEntry(StringBuilder out, Entry entry) {
        for (String comment : entry.getComments()) {
            out.append(CommentKind.TRANSLATOR.render(comment)).append('\n');
        }
        for (String comment : entry.getExtractedComments()) {
            out.append(CommentKind.EXTRACTED.render(comment)).append('\n');
        }
        for (String line : referenceWrapper.wrap(entry.getReferences())) {
            out.append(line).append('\n');
        }
        if (!entry.getFlags().isEmpty()) {
            out.append(CommentKind.FLAG.render(String.join(", ", entry.getFlags()))).append('\n');
        }
        if (entry.getPreviousMessage() != null) {
            writePrevious(out, entry.getPreviousMessage());
        }

        String prefix = entry.isObsolete() ? OBSOLETE_PREFIX : "";
        if (entry.getMsgctxt() != null) {
            writeField(out, prefix, "msgctxt", entry.getMsgctxt());
        }
        writeField(out, prefix, "msgid", entry.getMsgid());

        if (entry instanceof PluralEntry plural) {
            writeField(out, prefix, "msgid_plural", plural.getMsgidPlural());
            plural.getMsgstr().forEach((index, fragments) ->
                    writeField(out, prefix, "msgstr[" + index + "]", fragments));
        } else {
            writeField(out, prefix, "msgstr", ((SingularEntry) entry).getMsgstr());
        }
    }

    private void writePrevious(StringBuilder out, PreviousMessage previous) {
        if (previous.getMsgctxt() != null) {
            writeField(out, PREVIOUS_PREFIX, "msgctxt", previous.getMsgctxt());
        }
        writeField(out, PREVIOUS_PREFIX, "msgid", previous.getMsgid());
        if (previous.getMsgidPlural() != null) {
            writeField(out, PREVIOUS_PREFIX, "msgid_plural", previous.getMsgidPlural());
        }
    }

    private void writeField(StringBuilder out, String prefix, String keyword, List<String> fragments) {
        out.append(prefix).append(keyword).append(' ').append(quote(fragments.get(0))).append('\n');
        for (int i = 1; i < fragments.size(); i++) {
            out.append(prefix).append(quote(fragments.get(i))).append('\n');
        }
    }

    private static String quote(String value) {
        return "\"" + PoEscapes.escape(value) + "\"";
    }
}
