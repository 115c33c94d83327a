package teranet.mapdev.loadseries.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional per-run overrides of the configured folders. Null fields fall back to
 * pipeline.* properties.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunRequestDto {

    @JsonProperty("input_root")
    private String inputRoot;

    @JsonProperty("work_root")
    private String workRoot;

    @JsonProperty("output_root")
    private String outputRoot;

    /** Run the publish step even when pipeline.publish.enabled is false, or skip it */
    @JsonProperty("publish")
    private Boolean publish;

    @JsonProperty("publish_root")
    private String publishRoot;
}
