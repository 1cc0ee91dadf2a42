package com.hyperhook.backend.exchange.hyperliquid;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.asn1.x9.X9IntegerConverter;
import org.bouncycastle.crypto.digests.KeccakDigest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECAlgorithms;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.util.BigIntegers;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Signs exchange "L1 actions": the msgpack action hash becomes the {@code connectionId}
 * of an EIP-712 {@code Agent} message, signed with the wallet's secp256k1 key.
 */
public class HyperliquidSigner {

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(), CURVE_PARAMS.getG(), CURVE_PARAMS.getN(), CURVE_PARAMS.getH());
    private static final BigInteger HALF_CURVE_ORDER = CURVE_PARAMS.getN().shiftRight(1);

    private static final long CHAIN_ID = 1337L;
    private static final byte[] DOMAIN_TYPE_HASH = keccak256(
            "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)");
    private static final byte[] AGENT_TYPE_HASH = keccak256("Agent(string source,bytes32 connectionId)");
    private static final byte[] DOMAIN_SEPARATOR = concat(
            DOMAIN_TYPE_HASH,
            keccak256("Exchange"),
            keccak256("1"),
            uint256(BigInteger.valueOf(CHAIN_ID)),
            new byte[32]);

    private final BigInteger privateKey;
    private final byte[] publicKey;
    private final String address;
    private final boolean mainnet;

    public HyperliquidSigner(String privateKeyHex, boolean mainnet) {
        this.privateKey = parsePrivateKey(privateKeyHex);
        this.publicKey = publicKeyOf(privateKey);
        this.address = addressOf(publicKey);
        this.mainnet = mainnet;
    }

    public String address() {
        return address;
    }

    public boolean isMainnet() {
        return mainnet;
    }

    /**
     * {@code keccak256(msgpack(action) || nonce as 8 bytes big-endian || 0x00)}; the trailing
     * zero byte marks "no vault address".
     */
    public byte[] actionHash(Object action, long nonce) {
        byte[] packed = ActionPacker.pack(action);
        byte[] nonceBytes = ByteBuffer.allocate(Long.BYTES).putLong(nonce).array();
        return keccak256(concat(packed, nonceBytes, new byte[]{0x00}));
    }

    public byte[] l1ActionDigest(Object action, long nonce) {
        byte[] connectionId = actionHash(action, nonce);
        byte[] structHash = keccak256(concat(
                AGENT_TYPE_HASH,
                keccak256(mainnet ? "a" : "b"),
                connectionId));
        return keccak256(concat(new byte[]{0x19, 0x01}, DOMAIN_SEPARATOR, structHash));
    }

    public Signature signL1Action(Object action, long nonce) {
        return sign(l1ActionDigest(action, nonce));
    }

    Signature sign(byte[] digest) {
        ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
        signer.init(true, new ECPrivateKeyParameters(privateKey, CURVE));
        BigInteger[] components = signer.generateSignature(digest);
        BigInteger r = components[0];
        BigInteger s = components[1];
        if (s.compareTo(HALF_CURVE_ORDER) > 0) {
            s = CURVE.getN().subtract(s);
        }
        for (int recId = 0; recId < 2; recId++) {
            byte[] recovered = recoverPublicKey(recId, r, s, digest);
            if (recovered != null && Arrays.equals(recovered, publicKey)) {
                return new Signature(toHex32(r), toHex32(s), 27 + recId);
            }
        }
        throw new IllegalStateException("Could not construct a recoverable signature");
    }

    /**
     * Address that produced {@code signature} over {@code digest}, or {@code null} if it
     * cannot be recovered.
     */
    public static String recoverAddress(byte[] digest, Signature signature) {
        BigInteger r = new BigInteger(signature.r().substring(2), 16);
        BigInteger s = new BigInteger(signature.s().substring(2), 16);
        byte[] recovered = recoverPublicKey(signature.v() - 27, r, s, digest);
        return recovered == null ? null : addressOf(recovered);
    }

    public static byte[] keccak256(byte[] input) {
        KeccakDigest digest = new KeccakDigest(256);
        digest.update(input, 0, input.length);
        byte[] out = new byte[32];
        digest.doFinal(out, 0);
        return out;
    }

    private static byte[] keccak256(String text) {
        return keccak256(text.getBytes(StandardCharsets.UTF_8));
    }

    private static BigInteger parsePrivateKey(String privateKeyHex) {
        if (privateKeyHex == null || privateKeyHex.isBlank()) {
            throw new IllegalArgumentException("Private key is empty");
        }
        String hex = privateKeyHex.trim();
        if (hex.startsWith("0x") || hex.startsWith("0X")) {
            hex = hex.substring(2);
        }
        byte[] raw;
        try {
            raw = Hex.decode(hex);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Private key is not valid hex", e);
        }
        if (raw.length != 32) {
            throw new IllegalArgumentException("Private key must be 32 bytes, got " + raw.length);
        }
        BigInteger key = new BigInteger(1, raw);
        if (key.signum() == 0 || key.compareTo(CURVE.getN()) >= 0) {
            throw new IllegalArgumentException("Private key is outside the secp256k1 range");
        }
        return key;
    }

    private static byte[] publicKeyOf(BigInteger privateKey) {
        ECPoint point = new FixedPointCombMultiplier().multiply(CURVE.getG(), privateKey).normalize();
        byte[] encoded = point.getEncoded(false);
        return Arrays.copyOfRange(encoded, 1, encoded.length);
    }

    private static String addressOf(byte[] publicKey) {
        byte[] hash = keccak256(publicKey);
        return "0x" + Hex.toHexString(Arrays.copyOfRange(hash, hash.length - 20, hash.length));
    }

    private static byte[] recoverPublicKey(int recId, BigInteger r, BigInteger s, byte[] digest) {
        BigInteger n = CURVE.getN();
        BigInteger x = r.add(BigInteger.valueOf(recId / 2L).multiply(n));
        BigInteger prime = CURVE.getCurve().getField().getCharacteristic();
        if (x.compareTo(prime) >= 0) {
            return null;
        }
        ECPoint point = decompressKey(x, (recId & 1) == 1);
        if (!point.multiply(n).isInfinity()) {
            return null;
        }
        BigInteger e = new BigInteger(1, digest);
        BigInteger eInv = BigInteger.ZERO.subtract(e).mod(n);
        BigInteger rInv = r.modInverse(n);
        BigInteger srInv = rInv.multiply(s).mod(n);
        BigInteger eInvrInv = rInv.multiply(eInv).mod(n);
        ECPoint q = ECAlgorithms.sumOfTwoMultiplies(CURVE.getG(), eInvrInv, point, srInv).normalize();
        if (q.isInfinity()) {
            return null;
        }
        byte[] encoded = q.getEncoded(false);
        return Arrays.copyOfRange(encoded, 1, encoded.length);
    }

    private static ECPoint decompressKey(BigInteger x, boolean yBit) {
        X9IntegerConverter converter = new X9IntegerConverter();
        byte[] compressed = converter.integerToBytes(x, 1 + converter.getByteLength(CURVE.getCurve()));
        compressed[0] = (byte) (yBit ? 0x03 : 0x02);
        return CURVE.getCurve().decodePoint(compressed);
    }

    private static byte[] uint256(BigInteger value) {
        return BigIntegers.asUnsignedByteArray(32, value);
    }

    private static String toHex32(BigInteger value) {
        return "0x" + Hex.toHexString(uint256(value));
    }

    private static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }

    public record Signature(String r, String s, int v) {
    }
}
