package com.jz.hive.guard;
import lombok.*;

@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class ScreenVerdict {
    private boolean flagged;
    /** 命中的词，干净时为空 */
    private String matchedTerm;

    public static ScreenVerdict clean() {
        return ScreenVerdict.builder().flagged(false).build();
    }
    public static ScreenVerdict flagged(String term) {
        return ScreenVerdict.builder().flagged(true).matchedTerm(term).build();
    }
}
