package bbt.tao.lexroute;

import bbt.tao.lexroute.service.context.ContextBudgets;
import bbt.tao.lexroute.service.context.Truncation;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TruncationTest {

    @Test
    void keepsTextWithinBudget() {
        Truncation.Result result = Truncation.apply("короткий текст", 100);

        assertThat(result.truncated()).isFalse();
        assertThat(result.text()).isEqualTo("короткий текст");
    }

    @Test
    void cutsExactlyAtBudgetAndAppendsMarker() {
        String text = "а".repeat(ContextBudgets.RETRIEVAL_CONTEXT + 1);

        Truncation.Result result = Truncation.apply(text, ContextBudgets.RETRIEVAL_CONTEXT);

        assertThat(result.truncated()).isTrue();
        assertThat(result.text()).endsWith(ContextBudgets.TRUNCATION_MARKER);
        assertThat(result.text()).hasSize(ContextBudgets.RETRIEVAL_CONTEXT + ContextBudgets.TRUNCATION_MARKER.length());
    }

    @Test
    void textOfExactlyBudgetLengthIsUntouched() {
        String text = "б".repeat(ContextBudgets.SWEEP_DOCUMENT);

        assertThat(Truncation.apply(text, ContextBudgets.SWEEP_DOCUMENT).truncated()).isFalse();
    }

    @Test
    void previewFlattensWhitespace() {
        assertThat(Truncation.preview("рядок\n\n  другий", 300)).isEqualTo("рядок другий");
        assertThat(Truncation.preview("abcdef", 3)).isEqualTo("abc...");
        assertThat(Truncation.apply(null, 10).text()).isEmpty();
    }
}
