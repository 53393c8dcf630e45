package bbt.tao.lexroute.dto.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AnswerMetadata {
    private boolean usedRetrieval;
    private boolean usedLegal;
    private String intent;
    private int contextCount;
    @Builder.Default
    private List<String> errors = new ArrayList<>();
    private boolean cached;
}
