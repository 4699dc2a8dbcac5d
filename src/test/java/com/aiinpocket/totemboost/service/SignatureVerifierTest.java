package com.aiinpocket.totemboost.service;

import com.aiinpocket.totemboost.config.BoostProperties;
import com.aiinpocket.totemboost.exception.BoostException;
import com.aiinpocket.totemboost.model.dto.BoostSettingsSnapshot;
import com.aiinpocket.totemboost.model.entity.ConsumedSignature;
import com.aiinpocket.totemboost.model.enums.BoostError;
import com.aiinpocket.totemboost.repository.ConsumedSignatureRepository;
import com.aiinpocket.totemboost.support.MutableClock;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigInteger;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SignatureVerifier Tests")
class SignatureVerifierTest {

    private static final String USER = "0x1111111111111111111111111111111111111111";
    private static final String TOTEM = "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";

    private static KeyPair frontendSigner;
    private static KeyPair stranger;

    @Mock
    private ConsumedSignatureRepository consumedRepo;

    @Mock
    private BoostSettingsService settingsService;

    @Captor
    private ArgumentCaptor<ConsumedSignature> consumedCaptor;

    private MutableClock clock;
    private SignatureVerifier verifier;
    private final Set<String> consumed = new HashSet<>();

    @BeforeAll
    static void generateKeys() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(new ECGenParameterSpec("secp256r1"));
        frontendSigner = generator.generateKeyPair();
        stranger = generator.generateKeyPair();
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-05-01T12:00:00Z"));
        BoostProperties props = new BoostProperties(Duration.ofHours(24), 30, Duration.ofMinutes(5), 100L,
                BigInteger.TEN, BigInteger.ONE, null, null, List.of(), null, Duration.ofHours(6));
        verifier = new SignatureVerifier(consumedRepo, settingsService, props, clock);

        lenient().when(settingsService.current()).thenReturn(settingsWithSigner(
                Base64.getEncoder().encodeToString(frontendSigner.getPublic().getEncoded())));
        lenient().when(consumedRepo.existsById(anyString())).thenAnswer(inv -> consumed.contains(inv.getArgument(0)));
        lenient().when(consumedRepo.saveAndFlush(any(ConsumedSignature.class))).thenAnswer(inv -> {
            ConsumedSignature s = inv.getArgument(0);
            consumed.add(s.getMessageDigest());
            return s;
        });
    }

    @Test
    @DisplayName("Should accept a fresh signature and mark it consumed")
    void shouldAcceptValidSignature() throws Exception {
        long ts = clock.epochSecond();

        verifier.verify(USER, TOTEM, ts, sign(frontendSigner, USER, TOTEM, ts));

        verify(consumedRepo).saveAndFlush(consumedCaptor.capture());
        ConsumedSignature saved = consumedCaptor.getValue();
        assertThat(saved.getMessageDigest()).hasSize(64);
        assertThat(saved.getUserAddress()).isEqualTo(USER);
        assertThat(saved.getSignedAt()).isEqualTo(Instant.ofEpochSecond(ts));
    }

    @Test
    @DisplayName("Should reject replay of a consumed tuple")
    void shouldRejectReplay() throws Exception {
        long ts = clock.epochSecond();
        String signature = sign(frontendSigner, USER, TOTEM, ts);
        verifier.verify(USER, TOTEM, ts, signature);

        assertThatThrownBy(() -> verifier.verify(USER, TOTEM, ts, signature))
                .isInstanceOf(BoostException.class)
                .extracting(e -> ((BoostException) e).getError())
                .isEqualTo(BoostError.SIGNATURE_ALREADY_USED);
    }

    @Test
    @DisplayName("Should report a concurrent duplicate insert as an already used signature")
    void shouldRejectConcurrentReplay() throws Exception {
        // Given: another request consumed the same tuple between the lookup and the insert
        long ts = clock.epochSecond();
        doThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"))
                .when(consumedRepo).saveAndFlush(any(ConsumedSignature.class));

        // When / Then
        assertThatThrownBy(() -> verifier.verify(USER, TOTEM, ts, sign(frontendSigner, USER, TOTEM, ts)))
                .isInstanceOf(BoostException.class)
                .hasCauseInstanceOf(DataIntegrityViolationException.class)
                .extracting(e -> ((BoostException) e).getError())
                .isEqualTo(BoostError.SIGNATURE_ALREADY_USED);
    }

    @Test
    @DisplayName("Should reject a signature from another key")
    void shouldRejectForeignSigner() throws Exception {
        long ts = clock.epochSecond();

        assertThatThrownBy(() -> verifier.verify(USER, TOTEM, ts, sign(stranger, USER, TOTEM, ts)))
                .extracting(e -> ((BoostException) e).getError())
                .isEqualTo(BoostError.INVALID_SIGNATURE);
        verify(consumedRepo, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("Should reject a signature over a different totem")
    void shouldBindSignatureToTotem() throws Exception {
        long ts = clock.epochSecond();
        String otherTotem = "0xbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb";

        assertThatThrownBy(() -> verifier.verify(USER, otherTotem, ts, sign(frontendSigner, USER, TOTEM, ts)))
                .extracting(e -> ((BoostException) e).getError())
                .isEqualTo(BoostError.INVALID_SIGNATURE);
    }

    @Test
    @DisplayName("Should reject garbage and missing signer configuration as invalid")
    void shouldTreatUndecodableAsInvalid() {
        long ts = clock.epochSecond();
        assertThatThrownBy(() -> verifier.verify(USER, TOTEM, ts, "not-base64!!"))
                .extracting(e -> ((BoostException) e).getError())
                .isEqualTo(BoostError.INVALID_SIGNATURE);

        when(settingsService.current()).thenReturn(settingsWithSigner(null));
        assertThatThrownBy(() -> verifier.verify(USER, TOTEM, ts, "AAAA"))
                .extracting(e -> ((BoostException) e).getError())
                .isEqualTo(BoostError.INVALID_SIGNATURE);
    }

    @Test
    @DisplayName("Should reject timestamps outside the 5 minute tolerance in either direction")
    void shouldRejectExpired() throws Exception {
        long old = clock.epochSecond() - 301;
        long future = clock.epochSecond() + 301;
        long edge = clock.epochSecond() - 300;

        assertThatThrownBy(() -> verifier.verify(USER, TOTEM, old, sign(frontendSigner, USER, TOTEM, old)))
                .extracting(e -> ((BoostException) e).getError())
                .isEqualTo(BoostError.SIGNATURE_EXPIRED);
        assertThatThrownBy(() -> verifier.verify(USER, TOTEM, future, sign(frontendSigner, USER, TOTEM, future)))
                .extracting(e -> ((BoostException) e).getError())
                .isEqualTo(BoostError.SIGNATURE_EXPIRED);

        verifier.verify(USER, TOTEM, edge, sign(frontendSigner, USER, TOTEM, edge));
        assertThat(consumed).hasSize(1);
    }

    @Test
    @DisplayName("Should purge consumed entries older than the tolerance")
    void shouldPurgeExpired() {
        when(consumedRepo.deleteSignedBefore(Instant.parse("2026-05-01T11:55:00Z"))).thenReturn(4);

        assertThat(verifier.purgeExpired()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should refuse to decode a malformed public key")
    void shouldRejectMalformedKey() {
        assertThatThrownBy(() -> SignatureVerifier.decodePublicKey("AAAA"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SignatureVerifier.decodePublicKey(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static String sign(KeyPair keys, String user, String totem, long ts) throws Exception {
        Signature signer = Signature.getInstance(SignatureVerifier.SIGNATURE_ALGORITHM);
        signer.initSign(keys.getPrivate());
        signer.update(SignatureVerifier.message(user, totem, ts));
        return Base64.getEncoder().encodeToString(signer.sign());
    }

    private static BoostSettingsSnapshot settingsWithSigner(String key) {
        return new BoostSettingsSnapshot(100L, BigInteger.TEN, Duration.ofHours(24), key, null, false);
    }
}
