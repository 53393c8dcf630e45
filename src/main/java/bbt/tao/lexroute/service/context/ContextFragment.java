package bbt.tao.lexroute.service.context;

/**
 * Один помеченный фрагмент контекста (сводка, документы, практика) для промпта.
 */
public record ContextFragment(Kind kind, String label, String text, boolean truncated) {

    public enum Kind {
        SUMMARY(null),
        RETRIEVAL("RAG"),
        LEGAL("MCP_Law");

        private final String source;

        Kind(String source) {
            this.source = source;
        }

        /**
         * @return имя источника для поля {@code sources} ответа, {@code null} для сводки
         */
        public String source() {
            return source;
        }
    }

    public String render() {
        return "=== " + label + " ===\n" + text;
    }
}
