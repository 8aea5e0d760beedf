package dao.fhe.mystery.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class CooldownRequest {

    @NotNull
    @Min(0)
    private Long cooldownSeconds;
}
