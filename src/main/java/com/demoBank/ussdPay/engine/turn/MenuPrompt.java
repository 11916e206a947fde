package com.demoBank.ussdPay.engine.turn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numbered options parsed out of a turn.
 *
 * Items are delimited by "N." or "N)" markers that start a line or follow whitespace,
 * so menus rendered on one line parse the same as one item per line. Amounts such as
 * "5.00" or "Rs.1,000" are not markers.
 */
public final class MenuPrompt {

    private static final Pattern ITEM_MARKER = Pattern.compile("(?<![^\\s])(\\d{1,2})[.)](?!\\d)\\s*");

    private final List<MenuItem> items;

    private MenuPrompt(List<MenuItem> items) {
        this.items = items;
    }

    public static MenuPrompt parse(String text) {
        if (text == null || text.isEmpty()) {
            return new MenuPrompt(List.of());
        }
        List<MenuItem> items = new ArrayList<>();
        Matcher matcher = ITEM_MARKER.matcher(text);
        String number = null;
        int labelStart = -1;
        while (matcher.find()) {
            if (number != null) {
                items.add(new MenuItem(number, text.substring(labelStart, matcher.start()).trim()));
            }
            number = matcher.group(1);
            labelStart = matcher.end();
        }
        if (number != null) {
            items.add(new MenuItem(number, firstLine(text.substring(labelStart))));
        }
        return new MenuPrompt(Collections.unmodifiableList(items));
    }

    public List<MenuItem> items() {
        return items;
    }

    /**
     * A menu turn offers at least two numbered options.
     */
    public boolean isMenu() {
        return items.size() >= 2;
    }

    /**
     * Finds the first option, in menu order, whose label contains one of the keywords.
     *
     * @param keywords lower-case keywords
     * @return the option number to send back, or empty if nothing matched
     */
    public Optional<String> findOption(List<String> keywords) {
        for (MenuItem item : items) {
            String label = item.label().toLowerCase(Locale.ROOT);
            for (String keyword : keywords) {
                if (label.contains(keyword)) {
                    return Optional.of(item.number());
                }
            }
        }
        return Optional.empty();
    }

    private static String firstLine(String tail) {
        int newline = tail.indexOf('\n');
        return (newline >= 0 ? tail.substring(0, newline) : tail).trim();
    }

    public record MenuItem(String number, String label) {
    }
}
