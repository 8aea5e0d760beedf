package dao.fhe.mystery.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ProviderRequest {

    @NotBlank
    private String identity;
}
