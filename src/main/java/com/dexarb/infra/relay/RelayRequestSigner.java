package com.dexarb.infra.relay;

import com.dexarb.infra.SigningKeyUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Produces the {@code X-Flashbots-Signature} header value: {@code <address>:<signature>} where the
 * signature is an EIP-191 personal signature over the hex keccak hash of the request body.
 * <p>
 * The key only builds relay reputation; it must never hold funds.
 */
@Slf4j
public class RelayRequestSigner {

    public static final String HEADER = "X-Flashbots-Signature";

    private final Credentials credentials;

    public RelayRequestSigner(String signingKey) {
        if (signingKey == null || signingKey.isEmpty()) {
            this.credentials = null;
            log.warn("[RELAY] No relay signing key configured; bundle calls will be refused");
        } else {
            try {
                this.credentials = Credentials.create(signingKey);
            } catch (RuntimeException e) {
                throw new SigningKeyUnavailableException("Relay signing key could not be loaded", e);
            }
        }
    }

    public String address() {
        return credentials != null ? credentials.getAddress() : null;
    }

    public String sign(String body) {
        if (credentials == null) {
            throw new SigningKeyUnavailableException("Relay signing key is not configured");
        }
        String bodyHash = Hash.sha3String(body);
        Sign.SignatureData signature = Sign.signPrefixedMessage(
                bodyHash.getBytes(StandardCharsets.UTF_8), credentials.getEcKeyPair());

        ByteBuffer buffer = ByteBuffer.allocate(65);
        buffer.put(signature.getR());
        buffer.put(signature.getS());
        buffer.put(signature.getV());
        return credentials.getAddress() + ":" + Numeric.toHexString(buffer.array());
    }
}
