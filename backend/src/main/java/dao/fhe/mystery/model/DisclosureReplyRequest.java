package dao.fhe.mystery.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class DisclosureReplyRequest {

    @NotBlank
    @Pattern(regexp = "^(0x)?([0-9a-fA-F]{2})+$")
    private String cleartext;   // ABI-encoded words

    @NotBlank
    @Pattern(regexp = "^(0x)?[0-9a-fA-F]{130}$")
    private String proof;       // 65-byte signature r || s || v
}
