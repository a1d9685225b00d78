package se.chronotrust_be.util;

public class PaymentAccounts {

    public static final String PLATFORM = "platform";

    private PaymentAccounts() {
    }

    public static String user(Long userId) {
        return "user:" + userId;
    }

    public static String evaluator(Long evaluatorId) {
        return "evaluator:" + evaluatorId;
    }
}
