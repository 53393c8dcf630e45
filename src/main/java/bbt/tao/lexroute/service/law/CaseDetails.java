package bbt.tao.lexroute.service.law;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CaseDetails(
        @JsonAlias({"doc_id", "docId"}) String docId,
        @JsonAlias({"case_number", "caseNumber", "cause_num"}) String caseNumber,
        String title,
        @JsonAlias({"court", "court_name"}) String court,
        @JsonAlias({"date", "adjudication_date"}) String date,
        @JsonAlias({"judgment_form", "judgmentForm"}) String judgmentForm,
        @JsonAlias({"category", "category_name"}) String category,
        @JsonAlias({"summary", "resolution"}) String summary
) {

    /**
     * Текстовая карточка дела для промпта и прямого ответа.
     *
     * @param fallbackNumber номер из запроса, если сервис не вернул свой
     */
    public String describe(String fallbackNumber) {
        StringBuilder text = new StringBuilder("Справа № ")
                .append(caseNumber != null ? caseNumber : fallbackNumber);
        appendLine(text, "Назва", title);
        appendLine(text, "Суд", court);
        appendLine(text, "Дата", date);
        appendLine(text, "Форма рішення", judgmentForm);
        appendLine(text, "Категорія", category);
        appendLine(text, "Суть", summary);
        return text.toString();
    }

    private static void appendLine(StringBuilder text, String name, String value) {
        if (value != null && !value.isBlank()) {
            text.append('\n').append(name).append(": ").append(value);
        }
    }
}
