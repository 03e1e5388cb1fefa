package com.bulut.signature;

import com.bulut.common.AddressCodec;
import com.bulut.config.BulutProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the exact EIP-712 messages clients sign and verifies signatures
 * against them.
 *
 * Every message carries the configured domain (service name, version, chain id
 * and verifying contract), so a signature made for another service, chain or
 * payload never verifies here. Payment messages bind intent id, payment type,
 * payer, recipient(s), amount and currency.
 *
 * Signatures are 65-byte hex {@code r || s || v}; {@code v} may be 0/1 or 27/28.
 */
@Component
@Slf4j
public class SignatureAuthorizer {

    public static final String PAYMENT_AUTHORIZATION = "PaymentAuthorization";
    public static final String ALIAS_REGISTRATION = "AliasRegistration";
    public static final String ALIAS_DELETION = "AliasDeletion";

    private static final List<StructuredMessage.Field> PAYMENT_FIELDS = List.of(
        new StructuredMessage.Field("intentId", "string"),
        new StructuredMessage.Field("paymentType", "string"),
        new StructuredMessage.Field("from", "address"),
        new StructuredMessage.Field("to", "string"),
        new StructuredMessage.Field("amount", "string"),
        new StructuredMessage.Field("currency", "string"));

    private static final List<StructuredMessage.Field> ALIAS_FIELDS = List.of(
        new StructuredMessage.Field("alias", "string"),
        new StructuredMessage.Field("address", "address"));

    private final Map<String, Object> domain;

    public SignatureAuthorizer(BulutProperties properties) {
        BulutProperties.Domain d = properties.getDomain();
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", d.getName());
        map.put("version", d.getVersion());
        map.put("chainId", d.getChainId());
        map.put("verifyingContract", AddressCodec.normalize(d.getVerifyingContract()));
        this.domain = Collections.unmodifiableMap(map);

        log.info("Signature domain: name={}, version={}, chainId={}, verifyingContract={}",
            d.getName(), d.getVersion(), d.getChainId(), map.get("verifyingContract"));
    }

    /**
     * Message a payer signs to authorize one payment intent.
     *
     * @param to canonical recipient address, or for splits the comma-joined
     *           {@code address:share} list in intent order
     */
    public StructuredMessage buildAuthorizationMessage(String intentId, String paymentType, String from,
                                                       String to, BigDecimal amount, String currency) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("intentId", intentId);
        message.put("paymentType", paymentType);
        message.put("from", AddressCodec.normalize(from));
        message.put("to", to);
        message.put("amount", canonicalAmount(amount));
        message.put("currency", currency.trim().toUpperCase(Locale.ROOT));
        return new StructuredMessage(PAYMENT_AUTHORIZATION, PAYMENT_FIELDS, domain, message);
    }

    public StructuredMessage buildRegistrationMessage(String alias, String address) {
        return aliasMessage(ALIAS_REGISTRATION, alias, address);
    }

    public StructuredMessage buildDeletionMessage(String alias, String address) {
        return aliasMessage(ALIAS_DELETION, alias, address);
    }

    /**
     * Check that {@code signature} over {@code message} was produced by
     * {@code claimedAddress}. Never throws: anything malformed is a mismatch.
     */
    public boolean verify(StructuredMessage message, String signature, String claimedAddress) {
        if (!AddressCodec.isAddress(claimedAddress)) {
            return false;
        }
        Optional<String> signer = recoverSigner(message, signature);
        boolean ok = signer.isPresent() && signer.get().equals(AddressCodec.normalize(claimedAddress));
        if (!ok) {
            log.debug("Signature check failed for {} message", message.getPrimaryType());
        }
        return ok;
    }

    /**
     * Recover the address that produced {@code signature} over {@code message}.
     */
    public Optional<String> recoverSigner(StructuredMessage message, String signature) {
        byte[] digest;
        try {
            digest = message.digest();
        } catch (RuntimeException e) {
            log.debug("Cannot hash {} message: {}", message.getPrimaryType(), e.getMessage());
            return Optional.empty();
        }
        return recoverSigner(digest, signature);
    }

    /**
     * Check a signature against a digest recorded earlier, for a retry of an
     * intent whose message was already verified once.
     */
    public boolean verifyDigest(byte[] digest, String signature, String claimedAddress) {
        if (!AddressCodec.isAddress(claimedAddress)) {
            return false;
        }
        Optional<String> signer = recoverSigner(digest, signature);
        return signer.isPresent() && signer.get().equals(AddressCodec.normalize(claimedAddress));
    }

    private Optional<String> recoverSigner(byte[] digest, String signature) {
        try {
            if (signature == null || signature.isBlank()) {
                return Optional.empty();
            }
            byte[] raw = Numeric.hexStringToByteArray(signature.trim());
            if (raw.length != 65) {
                return Optional.empty();
            }
            byte v = raw[64];
            if (v < 27) {
                v += 27;
            }
            if (v != 27 && v != 28) {
                return Optional.empty();
            }
            Sign.SignatureData data = new Sign.SignatureData(v,
                Arrays.copyOfRange(raw, 0, 32),
                Arrays.copyOfRange(raw, 32, 64));
            BigInteger publicKey = Sign.signedMessageHashToKey(digest, data);
            return Optional.of("0x" + Keys.getAddress(publicKey).toLowerCase(Locale.ROOT));
        } catch (Exception e) {
            log.debug("Signature recovery failed: {}", e.getClass().getSimpleName());
            return Optional.empty();
        }
    }

    /**
     * Plain decimal form with no exponent and no trailing zeros, so 50, 50.0
     * and 50.00 sign identically.
     */
    public static String canonicalAmount(BigDecimal amount) {
        BigDecimal stripped = amount.stripTrailingZeros();
        if (stripped.scale() < 0) {
            stripped = stripped.setScale(0);
        }
        return stripped.toPlainString();
    }

    private StructuredMessage aliasMessage(String primaryType, String alias, String address) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("alias", AddressCodec.normalizeAlias(alias));
        message.put("address", AddressCodec.normalize(address));
        return new StructuredMessage(primaryType, ALIAS_FIELDS, domain, message);
    }
}
