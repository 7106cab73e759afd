package com.myorg.normparser.service.processing;

import com.myorg.normparser.model.NoteEntry;
import com.myorg.normparser.util.TextCleaner;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the footnote lines that follow the "Примечание" title row.
 *
 * <p>A line starting with digits opens a new note keyed by those digits. Any other line
 * continues the open note. Lines before the first numbered one are dropped.
 */
@Slf4j
public class FootnoteSectionParser {

    private static final Pattern LEADING_KEY = Pattern.compile("^\\d+");

    public List<NoteEntry> parse(List<String> lines) {
        List<NoteEntry> notes = new ArrayList<>();
        NoteEntry current = null;

        for (String raw : lines) {
            String text = TextCleaner.clean(raw);
            if (text == null || text.isEmpty()) continue;

            Matcher m = LEADING_KEY.matcher(text);
            if (m.find()) {
                String key = m.group();
                current = new NoteEntry(key, text.substring(key.length()).trim());
                notes.add(current);
            } else if (current != null) {
                current.append(text);
            } else {
                log.debug("Footnote line without a preceding key dropped: '{}'", text);
            }
        }
        return notes;
    }
}
