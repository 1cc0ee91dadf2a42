package com.hyperhook.backend.exchange.hyperliquid;

import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HyperliquidSignerTest {

    private static final String KEY_ONE = "0x0000000000000000000000000000000000000000000000000000000000000001";

    @Test
    void keccakMatchesKnownVectors() {
        assertThat(Hex.toHexString(HyperliquidSigner.keccak256(new byte[0])))
                .isEqualTo("c5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470");
        assertThat(Hex.toHexString(HyperliquidSigner.keccak256("hello".getBytes(StandardCharsets.UTF_8))))
                .isEqualTo("1c8aff950685c2ed4bc3174f3472287b56d9517b9c948127319a09a7a36deac8");
    }

    @Test
    void derivesAddressFromPrivateKey() {
        HyperliquidSigner signer = new HyperliquidSigner(KEY_ONE, true);

        assertThat(signer.address()).isEqualTo("0x7e5f4552091a69125d5dfcb7b8c2659029395bdf");
    }

    @Test
    void acceptsKeyWithoutPrefix() {
        HyperliquidSigner signer = new HyperliquidSigner(KEY_ONE.substring(2), false);

        assertThat(signer.address()).isEqualTo("0x7e5f4552091a69125d5dfcb7b8c2659029395bdf");
        assertThat(signer.isMainnet()).isFalse();
    }

    @Test
    void rejectsMalformedKeys() {
        assertThatThrownBy(() -> new HyperliquidSigner("0x1234", true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HyperliquidSigner("not-hex", true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HyperliquidSigner("", true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void signatureRecoversToWalletAddress() {
        HyperliquidSigner signer = new HyperliquidSigner(
                "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318", true);
        Map<String, Object> action = leverageAction();
        long nonce = 1_700_000_000_000L;

        HyperliquidSigner.Signature signature = signer.signL1Action(action, nonce);
        byte[] digest = signer.l1ActionDigest(action, nonce);

        assertThat(signature.v()).isIn(27, 28);
        assertThat(signature.r()).startsWith("0x").hasSize(66);
        assertThat(signature.s()).startsWith("0x").hasSize(66);
        assertThat(HyperliquidSigner.recoverAddress(digest, signature)).isEqualTo(signer.address());
    }

    @Test
    void signaturesUseLowS() {
        HyperliquidSigner signer = new HyperliquidSigner(KEY_ONE, true);
        BigInteger halfOrder = HyperliquidSigner.CURVE.getN().shiftRight(1);

        for (long nonce = 1; nonce <= 20; nonce++) {
            HyperliquidSigner.Signature signature = signer.signL1Action(leverageAction(), nonce);
            assertThat(new BigInteger(signature.s().substring(2), 16)).isLessThanOrEqualTo(halfOrder);
        }
    }

    @Test
    void signingIsDeterministic() {
        HyperliquidSigner signer = new HyperliquidSigner(KEY_ONE, true);

        assertThat(signer.signL1Action(leverageAction(), 42L))
                .isEqualTo(signer.signL1Action(leverageAction(), 42L));
    }

    @Test
    void digestDependsOnNetworkAndNonce() {
        HyperliquidSigner mainnet = new HyperliquidSigner(KEY_ONE, true);
        HyperliquidSigner testnet = new HyperliquidSigner(KEY_ONE, false);
        Map<String, Object> action = leverageAction();

        assertThat(mainnet.actionHash(action, 1L)).isEqualTo(testnet.actionHash(action, 1L));
        assertThat(mainnet.l1ActionDigest(action, 1L)).isNotEqualTo(testnet.l1ActionDigest(action, 1L));
        assertThat(mainnet.actionHash(action, 1L)).isNotEqualTo(mainnet.actionHash(action, 2L));
    }

    private static Map<String, Object> leverageAction() {
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("type", "updateLeverage");
        action.put("asset", 0);
        action.put("isCross", true);
        action.put("leverage", 20);
        return action;
    }
}
