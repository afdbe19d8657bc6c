package com.dexarb.infra.relay;

import com.dexarb.infra.SigningKeyUnavailableException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

class RelayRequestSignerTest {

    @Test
    void testHeaderRecoversToSigningAddress() throws Exception {
        // 1. Setup key
        ECKeyPair keyPair = Keys.createEcKeyPair();
        Credentials credentials = Credentials.create(keyPair);
        RelayRequestSigner signer = new RelayRequestSigner(
                Numeric.toHexStringWithPrefixZeroPadded(keyPair.getPrivateKey(), 64));
        Assertions.assertEquals(credentials.getAddress(), signer.address());

        // 2. Sign a request body
        String body = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"eth_sendBundle\",\"params\":[]}";
        String header = signer.sign(body);

        String[] parts = header.split(":");
        Assertions.assertEquals(2, parts.length);
        Assertions.assertEquals(credentials.getAddress(), parts[0]);
        Assertions.assertEquals(132, parts[1].length()); // 65 bytes = 130 hex chars + 0x

        // 3. The signature is a personal_sign over the hex keccak of the body
        byte[] sig = Numeric.hexStringToByteArray(parts[1]);
        Sign.SignatureData signatureData = new Sign.SignatureData(
                sig[64], Arrays.copyOfRange(sig, 0, 32), Arrays.copyOfRange(sig, 32, 64));
        BigInteger publicKey = Sign.signedPrefixedMessageToKey(
                Hash.sha3String(body).getBytes(StandardCharsets.UTF_8), signatureData);

        Assertions.assertEquals(Numeric.cleanHexPrefix(credentials.getAddress()), Keys.getAddress(publicKey));
    }

    @Test
    void testDifferentBodiesGetDifferentSignatures() throws Exception {
        RelayRequestSigner signer = new RelayRequestSigner(
                Numeric.toHexStringWithPrefixZeroPadded(Keys.createEcKeyPair().getPrivateKey(), 64));

        Assertions.assertNotEquals(signer.sign("{\"id\":1}"), signer.sign("{\"id\":2}"));
    }

    @Test
    void testMissingKeyRefusesToSign() {
        RelayRequestSigner signer = new RelayRequestSigner("");

        Assertions.assertNull(signer.address());
        Assertions.assertThrows(SigningKeyUnavailableException.class, () -> signer.sign("{}"));
    }

    @Test
    void testMalformedKeyIsFatal() {
        Assertions.assertThrows(SigningKeyUnavailableException.class, () -> new RelayRequestSigner("0xnot-a-key"));
    }
}
