package com.designtool.lowering.recognize;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Recognizes what kind of value a piece of text shows (a price, a date, a
 * phone number...). Patterns are tried in order and the first match wins.
 */
public class ContentPatternDetector {

    private static final List<String> CURRENCY_SYMBOLS = List.of("₽", "$", "€", "£", "¥", "₴", "₸", "₿");

    private static final List<String> PAYMENT_BRANDS = List.of(
            "МИР", "MIR", "MasterCard", "Visa", "СБП", "SBP", "Maestro",
            "UnionPay", "AmEx", "American Express", "JCB");

    // Stems cover nominative and genitive forms.
    private static final List<String> CYRILLIC_MONTHS = List.of(
            "январ", "феврал", "март", "апрел", "ма", "июн",
            "июл", "август", "сентябр", "октябр", "ноябр", "декабр");

    private static final List<String> LATIN_MONTHS = List.of(
            "january", "february", "march", "april", "may", "june",
            "july", "august", "september", "october", "november", "december",
            "jan", "feb", "mar", "apr", "jun", "jul", "aug", "sep", "sept", "oct", "nov", "dec");

    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern DAY = Pattern.compile("\\d{1,2}");
    private static final Pattern SIGNED_AMOUNT = Pattern.compile("^[+\\-−]\\s*[\\d\\s\\u00A0]+$");
    private static final Pattern THOUSAND_SEPARATOR = Pattern.compile("\\d[\\s\\u00A0]\\d");
    private static final Pattern CARD_LAST_DIGITS = Pattern.compile("^[•·*\\s]*\\d{4}$");
    private static final Pattern PHONE = Pattern.compile("^\\+\\d[\\d\\s\\-().]{7,}$");
    private static final Pattern PERCENTAGE = Pattern.compile("^[\\d\\s,.]+%$");

    private static final List<ContentPattern> PATTERNS = List.of(
            new ContentPattern("price", ContentPatternDetector::isPrice),
            new ContentPattern("amount", ContentPatternDetector::isSignedAmount),
            new ContentPattern("cardBrand", ContentPatternDetector::isCardBrand),
            new ContentPattern("cardLastDigits", text -> CARD_LAST_DIGITS.matcher(text).matches()),
            new ContentPattern("date", text -> hasMonthAndDay(text, CYRILLIC_MONTHS)),
            new ContentPattern("date", text -> hasMonthAndDay(text, LATIN_MONTHS)),
            new ContentPattern("phone", ContentPatternDetector::isPhone),
            new ContentPattern("percentage", text -> PERCENTAGE.matcher(text).matches() && hasDigit(text)));

    /**
     * @return the pattern name, or {@code null} when nothing matches
     */
    public String detect(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        for (ContentPattern pattern : PATTERNS) {
            if (pattern.test.test(trimmed)) {
                return pattern.name;
            }
        }
        return null;
    }

    private static boolean isPrice(String text) {
        return CURRENCY_SYMBOLS.stream().anyMatch(text::contains) && hasDigit(text);
    }

    // +30, -100, "- 3 000"; separators allow up to seven digits
    private static boolean isSignedAmount(String text) {
        if (!SIGNED_AMOUNT.matcher(text).matches() || !hasDigit(text)) {
            return false;
        }
        int digits = text.replaceAll("\\D", "").length();
        if (THOUSAND_SEPARATOR.matcher(text).find()) {
            return digits <= 7;
        }
        return digits <= 4;
    }

    private static boolean isCardBrand(String text) {
        return PAYMENT_BRANDS.stream().anyMatch(brand -> brand.equalsIgnoreCase(text));
    }

    private static boolean isPhone(String text) {
        return PHONE.matcher(text).matches() && text.replaceAll("\\D", "").length() >= 7;
    }

    private static boolean hasMonthAndDay(String text, List<String> months) {
        String lower = text.toLowerCase(Locale.ROOT);
        return months.stream().anyMatch(lower::contains) && DAY.matcher(lower).find();
    }

    private static boolean hasDigit(String text) {
        return DIGIT.matcher(text).find();
    }

    private static final class ContentPattern {
        private final String name;
        private final Predicate<String> test;

        private ContentPattern(String name, Predicate<String> test) {
            this.name = name;
            this.test = test;
        }
    }
}
