package com.quizharvester.core.walker;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 회차 라벨(令和6年春期, 平成31年春期, 2024春 …) → 서기 연도 */
public final class EraYears {

    private static final Map<String, Integer> ERA_OFFSETS = new LinkedHashMap<>();
    static {
        ERA_OFFSETS.put("令和", 2018);
        ERA_OFFSETS.put("平成", 1988);
        ERA_OFFSETS.put("昭和", 1925);
    }

    // 전각 숫자(令和６年)도 허용
    private static final Pattern DIGITS = Pattern.compile("\\d+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern YEAR4 = Pattern.compile("\\d{4}", Pattern.UNICODE_CHARACTER_CLASS);

    private EraYears() {}

    public static OptionalInt toGregorian(String label) {
        if (label == null || label.isBlank()) return OptionalInt.empty();
        for (Map.Entry<String, Integer> era : ERA_OFFSETS.entrySet()) {
            int at = label.indexOf(era.getKey());
            if (at < 0) continue;
            String rest = label.substring(at + era.getKey().length());
            if (rest.startsWith("元")) return OptionalInt.of(era.getValue() + 1);
            Matcher m = DIGITS.matcher(rest);
            if (!m.find()) continue;
            OptionalInt n = parse(m.group());
            return n.isPresent() ? OptionalInt.of(era.getValue() + n.getAsInt()) : n;
        }
        Matcher m = YEAR4.matcher(label);
        return m.find() ? parse(m.group()) : OptionalInt.empty();
    }

    /** 자릿수가 int 범위를 넘으면 empty */
    private static OptionalInt parse(String digits) {
        try {
            return OptionalInt.of(Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
