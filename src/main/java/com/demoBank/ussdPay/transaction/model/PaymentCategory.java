package com.demoBank.ussdPay.transaction.model;

import java.util.List;
import java.util.Locale;

/**
 * Spending category guessed from the remark of a payment.
 */
public enum PaymentCategory {
    FOOD_DINING("Food & Dining", List.of(
            "zomato", "swiggy", "dominos", "pizza", "restaurant", "cafe",
            "food", "burger", "kfc", "mcdonalds", "starbucks", "chai")),
    SHOPPING("Shopping", List.of(
            "amazon", "flipkart", "myntra", "ajio", "nykaa", "meesho",
            "shopping", "store", "mall", "mart", "shop")),
    GROCERIES("Groceries", List.of(
            "bigbasket", "blinkit", "zepto", "dmart", "grofers", "jiomart",
            "grocery", "vegetables", "fruits", "kirana", "supermarket")),
    TRANSPORT("Transport", List.of(
            "uber", "ola", "rapido", "metro", "petrol", "diesel", "fuel",
            "parking", "toll", "irctc", "redbus", "train", "flight")),
    ENTERTAINMENT("Entertainment", List.of(
            "netflix", "hotstar", "prime", "spotify", "gaana", "jio",
            "movie", "cinema", "pvr", "inox", "gaming", "game")),
    BILLS_UTILITIES("Bills & Utilities", List.of(
            "electricity", "water", "gas", "internet", "broadband", "recharge",
            "postpaid", "prepaid", "dth", "bill", "insurance", "emi")),
    HEALTH("Health", List.of(
            "hospital", "clinic", "pharmacy", "medical", "medicine", "doctor",
            "apollo", "pharmeasy", "netmeds", "1mg", "health", "lab")),
    EDUCATION("Education", List.of(
            "school", "college", "university", "course", "fees", "tuition",
            "book", "udemy", "coursera", "byju", "unacademy", "education")),
    PERSONAL_TRANSFER("Personal Transfer", List.of()),
    OTHER("Other", List.of());

    private final String label;
    private final List<String> keywords;

    PaymentCategory(String label, List<String> keywords) {
        this.label = label;
        this.keywords = keywords;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Categorizes a payment by its remark. Categories are tried in declaration order;
     * a remark matching none of them is a personal transfer.
     *
     * @param remark free-text remark, may be null
     * @return the category, {@link #OTHER} for a missing remark
     */
    public static PaymentCategory categorize(String remark) {
        if (remark == null || remark.isBlank()) {
            return OTHER;
        }
        String lower = remark.toLowerCase(Locale.ROOT);
        for (PaymentCategory category : values()) {
            if (category.keywords.stream().anyMatch(lower::contains)) {
                return category;
            }
        }
        return PERSONAL_TRANSFER;
    }
}
