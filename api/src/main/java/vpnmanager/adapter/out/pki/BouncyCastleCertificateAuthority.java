package vpnmanager.adapter.out.pki;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.spec.ECGenParameterSpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.CertIOException;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.openssl.jcajce.JcaPKCS8Generator;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.jboss.logging.Logger;

import vpnmanager.core.config.CertificateConfig;
import vpnmanager.core.model.certificate.CertificateType;
import vpnmanager.core.model.certificate.IssuanceRequest;
import vpnmanager.core.model.certificate.SignedCertificate;
import vpnmanager.core.port.out.CertificateAuthority;

/**
 * Local certificate authority backed by BouncyCastle.
 *
 * <p>Loads the CA certificate and key from PEM files when both paths are configured,
 * otherwise generates an ephemeral P-256 CA at startup. Every signing call generates a
 * fresh P-256 key pair for the subject and runs on the worker pool.
 */
@ApplicationScoped
public class BouncyCastleCertificateAuthority implements CertificateAuthority {

    private static final Logger LOG = Logger.getLogger(BouncyCastleCertificateAuthority.class);
    private static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";
    private static final String CURVE = "secp256r1";
    private static final Duration CA_VALIDITY = Duration.ofDays(3650);
    private static final Duration BACKDATE = Duration.ofMinutes(5);

    private final SecureRandom random = new SecureRandom();
    private final String organization;
    private final Clock clock;
    private final X509CertificateHolder caCertificate;
    private final PrivateKey caKey;
    private final String caPem;

    @Inject
    public BouncyCastleCertificateAuthority(CertificateConfig config) {
        this(config.organization(), config.authority(), Clock.systemUTC());
    }

    BouncyCastleCertificateAuthority(String organization, CertificateConfig.AuthorityConfig authority, Clock clock) {
        this.organization = organization;
        this.clock = clock;
        try {
            if (authority.certificatePath().isPresent() && authority.privateKeyPath().isPresent()) {
                final var certPath = Path.of(authority.certificatePath().get());
                LOG.infof("Loading certificate authority from %s", certPath);
                this.caCertificate = readCertificate(certPath);
                this.caKey = readPrivateKey(Path.of(authority.privateKeyPath().get()));
            } else {
                LOG.warnf("No CA key material configured, generating ephemeral CA '%s'", authority.commonName());
                final var keyPair = generateKeyPair();
                this.caKey = keyPair.getPrivate();
                this.caCertificate = selfSign(authority.commonName(), keyPair);
            }
            this.caPem = toPem(caCertificate);
        } catch (IOException | GeneralSecurityException | OperatorCreationException e) {
            throw new CertificateAuthorityException("Failed to initialize certificate authority", e);
        }
    }

    @Override
    public Uni<SignedCertificate> sign(IssuanceRequest request, Duration validity) {
        return Uni.createFrom()
                .item(() -> signBlocking(request, validity))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    private SignedCertificate signBlocking(IssuanceRequest request, Duration validity) {
        try {
            final var keyPair = generateKeyPair();
            final var now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
            final var notBefore = now.minus(BACKDATE);
            final var notAfter = now.plus(validity);
            final var serial = new BigInteger(127, random).add(BigInteger.ONE);
            final var subject = subjectFor(request);

            final X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                    caCertificate.getSubject(),
                    serial,
                    Date.from(notBefore),
                    Date.from(notAfter),
                    subject,
                    keyPair.getPublic());
            addLeafExtensions(builder, request.type(), keyPair.getPublic());

            final var holder = builder.build(signer(caKey));
            LOG.debugf("Signed %s certificate serial %s", request.type().wireName(), serial.toString(16));
            return new SignedCertificate(
                    holder.getEncoded(),
                    toPem(holder),
                    toPem(keyPair.getPrivate()),
                    holder.getSubject().toString(),
                    holder.getIssuer().toString(),
                    serial.toString(16),
                    notBefore,
                    notAfter);
        } catch (IOException | GeneralSecurityException | OperatorCreationException e) {
            throw new CertificateAuthorityException("Certificate signing failed", e);
        }
    }

    private X500Name subjectFor(IssuanceRequest request) {
        final var name = new X500NameBuilder(BCStyle.INSTANCE)
                .addRDN(BCStyle.CN, request.commonName())
                .addRDN(BCStyle.O, organization);
        if (request.email() != null && !request.email().isBlank()) {
            name.addRDN(BCStyle.EmailAddress, request.email());
        }
        return name.build();
    }

    private void addLeafExtensions(X509v3CertificateBuilder builder, CertificateType type, PublicKey publicKey)
            throws CertIOException, GeneralSecurityException {
        final var utils = new JcaX509ExtensionUtils();
        builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false));
        builder.addExtension(Extension.subjectKeyIdentifier, false, utils.createSubjectKeyIdentifier(publicKey));
        builder.addExtension(
                Extension.authorityKeyIdentifier,
                false,
                utils.createAuthorityKeyIdentifier(caCertificate.getSubjectPublicKeyInfo()));
        if (type == CertificateType.SERVER) {
            builder.addExtension(
                    Extension.keyUsage, true, new KeyUsage(KeyUsage.digitalSignature | KeyUsage.keyAgreement));
            builder.addExtension(
                    Extension.extendedKeyUsage, false, new ExtendedKeyUsage(KeyPurposeId.id_kp_serverAuth));
        } else {
            builder.addExtension(Extension.keyUsage, true, new KeyUsage(KeyUsage.digitalSignature));
            builder.addExtension(
                    Extension.extendedKeyUsage, false, new ExtendedKeyUsage(KeyPurposeId.id_kp_clientAuth));
        }
    }

    private X509CertificateHolder selfSign(String commonName, KeyPair keyPair)
            throws CertIOException, GeneralSecurityException, OperatorCreationException {
        final var now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        final var name = new X500NameBuilder(BCStyle.INSTANCE)
                .addRDN(BCStyle.CN, commonName)
                .addRDN(BCStyle.O, organization)
                .build();
        final var utils = new JcaX509ExtensionUtils();
        final var builder = new JcaX509v3CertificateBuilder(
                name,
                new BigInteger(127, random).add(BigInteger.ONE),
                Date.from(now.minus(BACKDATE)),
                Date.from(now.plus(CA_VALIDITY)),
                name,
                keyPair.getPublic());
        builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(0));
        builder.addExtension(Extension.keyUsage, true, new KeyUsage(KeyUsage.keyCertSign | KeyUsage.cRLSign));
        builder.addExtension(
                Extension.subjectKeyIdentifier, false, utils.createSubjectKeyIdentifier(keyPair.getPublic()));
        return builder.build(signer(keyPair.getPrivate()));
    }

    private static ContentSigner signer(PrivateKey key) throws OperatorCreationException {
        return new JcaContentSignerBuilder(SIGNATURE_ALGORITHM).build(key);
    }

    private KeyPair generateKeyPair() throws GeneralSecurityException {
        final var generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(new ECGenParameterSpec(CURVE), random);
        return generator.generateKeyPair();
    }

    private static X509CertificateHolder readCertificate(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.US_ASCII);
                PEMParser parser = new PEMParser(reader)) {
            final Object parsed = parser.readObject();
            if (parsed instanceof X509CertificateHolder holder) {
                return holder;
            }
            throw new IOException("No certificate found in " + path);
        }
    }

    private static PrivateKey readPrivateKey(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.US_ASCII);
                PEMParser parser = new PEMParser(reader)) {
            final Object parsed = parser.readObject();
            final var converter = new JcaPEMKeyConverter();
            if (parsed instanceof PEMKeyPair pair) {
                return converter.getKeyPair(pair).getPrivate();
            }
            if (parsed instanceof PrivateKeyInfo info) {
                return converter.getPrivateKey(info);
            }
            throw new IOException("No unencrypted private key found in " + path);
        }
    }

    private static String toPem(X509CertificateHolder holder) throws IOException {
        final var out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            writer.writeObject(holder);
        }
        return out.toString();
    }

    private static String toPem(PrivateKey key) throws IOException {
        final var out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            writer.writeObject(new JcaPKCS8Generator(key, null));
        }
        return out.toString();
    }

    @Override
    public String caCertificatePem() {
        return caPem;
    }

    @Override
    public String issuerDn() {
        return caCertificate.getSubject().toString();
    }

    @Override
    public boolean isUsable(Instant now) {
        return !now.isBefore(caCertificate.getNotBefore().toInstant())
                && now.isBefore(caCertificate.getNotAfter().toInstant());
    }
}
