package dao.fhe.mystery.oracle;

import dao.fhe.mystery.exception.ProtocolError;
import dao.fhe.mystery.exception.ProtocolException;
import dao.fhe.mystery.model.CipherType;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Disclosed cleartexts are ABI-encoded as one 32-byte word per value:
 * {@code bool} for boolean values, {@code uint256} otherwise.
 */
public final class CleartextCodec {
    private CleartextCodec() {}

    private static final int WORD = 32;

    @SuppressWarnings("rawtypes")
    public static byte[] encode(List<BigInteger> values, List<CipherType> types) {
        if (values.size() != types.size()) {
            throw new IllegalArgumentException("values/types size mismatch: " + values.size() + " vs " + types.size());
        }
        List<Type> params = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            if (types.get(i) == CipherType.BOOL) {
                params.add(new Bool(values.get(i).signum() != 0));
            } else {
                params.add(new Uint256(values.get(i)));
            }
        }
        return Numeric.hexStringToByteArray(FunctionEncoder.encodeConstructor(params));
    }

    public static boolean decodeBool(byte[] cleartext) {
        requireWords(cleartext, 1);
        Function fn = new Function(
                "accusationResult",
                List.of(),
                List.of(new TypeReference<Bool>() {})
        );
        @SuppressWarnings("rawtypes")
        List<Type> decoded = decode(cleartext, fn);
        return ((Bool) decoded.get(0)).getValue();
    }

    public static List<BigInteger> decodeUints(byte[] cleartext, int count) {
        requireWords(cleartext, count);
        List<TypeReference<?>> outputs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            outputs.add(new TypeReference<Uint256>() {});
        }
        Function fn = new Function("solutionResult", List.of(), outputs);
        @SuppressWarnings("rawtypes")
        List<Type> decoded = decode(cleartext, fn);
        List<BigInteger> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add(((Uint256) decoded.get(i)).getValue());
        }
        return out;
    }

    @SuppressWarnings("rawtypes")
    private static List<Type> decode(byte[] cleartext, Function fn) {
        List<Type> decoded;
        try {
            decoded = FunctionReturnDecoder.decode(Numeric.toHexString(cleartext), fn.getOutputParameters());
        } catch (RuntimeException e) {
            throw new ProtocolException(ProtocolError.MALFORMED_CLEARTEXT,
                    "Cannot decode cleartext for " + fn.getName() + ": " + e.getMessage(), e);
        }
        if (decoded.size() != fn.getOutputParameters().size()) {
            throw new ProtocolException(ProtocolError.MALFORMED_CLEARTEXT,
                    "Expected " + fn.getOutputParameters().size() + " values, decoded " + decoded.size());
        }
        return decoded;
    }

    private static void requireWords(byte[] cleartext, int words) {
        if (cleartext == null || cleartext.length != words * WORD) {
            throw new ProtocolException(ProtocolError.MALFORMED_CLEARTEXT,
                    "Cleartext must be exactly " + words + " ABI word(s), got "
                            + (cleartext == null ? 0 : cleartext.length) + " bytes");
        }
    }
}
