package bbt.tao.lexroute.dto.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {
    private String query;
    private String provider;
    private String model;
    private Boolean useRetrieval; // null - решает классификатор
    private Boolean useLegal;
    private Integer topK;
    private Boolean directFullText;
}
