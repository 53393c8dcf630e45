package bbt.tao.lexroute.service.context;

/**
 * Обрезка текста ровно до бюджета с маркером в конце.
 */
public final class Truncation {

    public record Result(String text, boolean truncated) {
    }

    private Truncation() {
    }

    public static Result apply(String text, int budget) {
        return apply(text, budget, ContextBudgets.TRUNCATION_MARKER);
    }

    public static Result apply(String text, int budget, String marker) {
        if (text == null) {
            return new Result("", false);
        }
        if (text.length() <= budget) {
            return new Result(text, false);
        }
        return new Result(text.substring(0, budget) + marker, true);
    }

    /**
     * Короткое превью без маркера, с многоточием.
     */
    public static String preview(String text, int budget) {
        if (text == null) {
            return "";
        }
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= budget ? flat : flat.substring(0, budget) + "...";
    }
}
