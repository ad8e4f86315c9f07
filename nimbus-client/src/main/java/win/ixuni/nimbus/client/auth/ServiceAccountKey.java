package win.ixuni.nimbus.client.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;

/**
 * Service account JSON key file
 */
@Data
public class ServiceAccountKey {

    private String type;

    @JsonProperty("project_id")
    private String projectId;

    @JsonProperty("client_email")
    private String clientEmail;

    @ToString.Exclude
    @JsonProperty("private_key")
    private String privateKey;

    @JsonProperty("private_key_id")
    private String privateKeyId;
}
