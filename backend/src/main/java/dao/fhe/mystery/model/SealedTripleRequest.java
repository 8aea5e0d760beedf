package dao.fhe.mystery.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class SealedTripleRequest {

    private static final String HANDLE = "^(0x)?[0-9a-fA-F]{64}$";

    @NotBlank
    @Pattern(regexp = HANDLE)
    private String weapon;      // bytes32 handle

    @NotBlank
    @Pattern(regexp = HANDLE)
    private String room;        // bytes32 handle

    @NotBlank
    @Pattern(regexp = HANDLE)
    private String suspect;     // bytes32 handle

    public SealedTriple toTriple() {
        return new SealedTriple(CipherHandle.uint(weapon), CipherHandle.uint(room), CipherHandle.uint(suspect));
    }
}
