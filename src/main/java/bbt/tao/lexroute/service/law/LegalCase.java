package bbt.tao.lexroute.service.law;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Строка результата поиска судебной практики.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegalCase(
        @JsonAlias({"doc_id", "docId"}) String docId,
        @JsonAlias({"case_number", "caseNumber", "cause_num"}) String caseNumber,
        String title,
        @JsonAlias({"court", "court_name"}) String court,
        @JsonAlias({"date", "adjudication_date"}) String date,
        String description
) {

    public String displayTitle() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        return caseNumber != null ? "Справа № " + caseNumber : "Справа";
    }
}
