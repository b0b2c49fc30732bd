package sovereignvpn.gateway.dto.node;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeListResponse {
    private final List<NodeResponse> nodes;
    private final int count;
    private final String region;
    @JsonProperty("min_rep")
    private final long minRep;
    @JsonProperty("rep_category")
    private final String repCategory;
}
