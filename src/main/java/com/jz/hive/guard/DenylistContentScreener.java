package com.jz.hive.guard;


import com.jz.hive.config.ModerationProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 敏感词子串匹配，大小写不敏感。
 * 不做词边界判断："spam" 会命中 "spammer"，"hell" 也会命中 "hello"，这是有意保留的行为。
 */
@Component
public class DenylistContentScreener implements ContentScreener {

    private final List<String> terms;

    public DenylistContentScreener(ModerationProperties props) {
        this.terms = props.getDenylist().stream()
                .filter(Objects::nonNull)
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .filter(t -> !t.isEmpty())
                .distinct()
                .toList();
    }

    @Override
    public ScreenVerdict screen(String text) {
        if (text == null || text.isBlank()) {
            return ScreenVerdict.clean();
        }
        String s = text.toLowerCase(Locale.ROOT);
        for (String t : terms) {
            if (s.contains(t)) return ScreenVerdict.flagged(t);
        }
        return ScreenVerdict.clean();
    }
}
