package io.certregistry.core.wallet;

import io.certregistry.core.protocol.SignatureUtil;

import javax.crypto.Cipher;
import javax.crypto.EncryptedPrivateKeyInfo;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.PBEParameterSpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Principal keys on disk: {@code <alias>.key} and {@code <alias>.pub}
 * (X.509 PEM) per wallet. The private key is PKCS#8 PEM, or an
 * {@code ENCRYPTED PRIVATE KEY} (PBES2) when created with a passphrase.
 * Encrypted wallets load locked and must be unlocked before signing.
 * <p>
 * Passphrase arrays are never cleared here; the caller owns them.
 */
public final class WalletStore {
    private static final String PRIV_EXT = ".key";
    private static final String PUB_EXT = ".pub";
    private static final String ENCRYPTED_TYPE = "ENCRYPTED PRIVATE KEY";
    private static final int SALT_BYTES = 16;
    private static final int ITERATIONS = 65_536;
    private static final String[] PBE_ALGORITHMS = {
            "PBEWithHmacSHA256AndAES_256",
            "PBEWithHmacSHA256AndAES_128"
    };

    private final Map<String, WalletRecord> wallets = new HashMap<>();
    private final Path directory;
    private final SecureRandom random = new SecureRandom();

    public WalletStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
        loadExisting();
    }

    private void loadExisting() {
        try {
            Files.createDirectories(directory);
            try (var stream = Files.list(directory)) {
                stream.filter(path -> path.getFileName().toString().endsWith(PRIV_EXT))
                        .forEach(this::loadWalletFromDisk);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize wallet store at " + directory, e);
        }
    }

    private void loadWalletFromDisk(Path privatePath) {
        String file = privatePath.getFileName().toString();
        String alias = file.substring(0, file.length() - PRIV_EXT.length());
        Path publicPath = directory.resolve(alias + PUB_EXT);
        if (!Files.exists(publicPath)) {
            return;
        }
        try {
            PublicKey publicKey = SignatureUtil.decodePublicKey(
                    fromPem("PUBLIC KEY", Files.readString(publicPath, StandardCharsets.US_ASCII)));
            String privPem = Files.readString(privatePath, StandardCharsets.US_ASCII);
            boolean encrypted = privPem.contains(ENCRYPTED_TYPE);
            Wallet wallet = encrypted ? null : new Wallet(new KeyPair(publicKey, decodePrivateKey(privPem, null)));
            wallets.put(alias, new WalletRecord(alias, publicKey, SignatureUtil.deriveAddress(publicKey),
                    privatePath, encrypted, wallet));
        } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to load wallet '" + alias + "'", e);
        }
    }

    public synchronized Wallet createWallet(String alias) throws IOException {
        return createWallet(alias, null);
    }

    /**
     * Generate and persist a wallet. A non-empty {@code passphrase} encrypts
     * the private key on disk; the returned wallet is unlocked either way.
     */
    public synchronized Wallet createWallet(String alias, char[] passphrase) throws IOException {
        Objects.requireNonNull(alias, "alias");
        validateAlias(alias);
        if (wallets.containsKey(alias)) {
            throw new IllegalArgumentException("Wallet alias already exists: " + alias);
        }
        Wallet wallet = Wallet.generate();
        boolean encrypted = passphrase != null && passphrase.length > 0;
        String privatePem;
        try {
            privatePem = encrypted
                    ? toPem(ENCRYPTED_TYPE, encryptPkcs8(wallet.getPrivateKey().getEncoded(), passphrase))
                    : toPem("PRIVATE KEY", wallet.getPrivateKey().getEncoded());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt private key for '" + alias + "'", e);
        }
        Files.createDirectories(directory);
        Path privatePath = directory.resolve(alias + PRIV_EXT);
        Files.writeString(privatePath, privatePem, StandardCharsets.US_ASCII);
        Files.writeString(directory.resolve(alias + PUB_EXT),
                toPem("PUBLIC KEY", wallet.getPublicKey().getEncoded()), StandardCharsets.US_ASCII);
        wallets.put(alias, new WalletRecord(alias, wallet.getPublicKey(), wallet.getAddress(),
                privatePath, encrypted, wallet));
        return wallet;
    }

    /**
     * Decrypt the private key of an encrypted wallet and keep it unlocked.
     *
     * @throws IllegalArgumentException for an unknown alias, a missing or a wrong passphrase
     */
    public synchronized Wallet unlockWallet(String alias, char[] passphrase) throws IOException {
        WalletRecord record = requireRecord(alias);
        if (record.wallet != null) {
            return record.wallet;
        }
        if (passphrase == null || passphrase.length == 0) {
            throw new IllegalArgumentException("Missing passphrase for encrypted wallet: " + alias);
        }
        String privPem = Files.readString(record.privatePath, StandardCharsets.US_ASCII);
        PrivateKey privateKey;
        try {
            privateKey = decodePrivateKey(privPem, passphrase);
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Cannot unlock wallet '" + alias + "': wrong passphrase", e);
        }
        record.wallet = new Wallet(new KeyPair(record.publicKey, privateKey));
        return record.wallet;
    }

    /** Existing wallet for {@code alias}, or a newly created one. */
    public synchronized Wallet ensureWallet(String alias) throws IOException {
        return ensureWallet(alias, null);
    }

    /** Like {@link #ensureWallet(String)}, unlocking or encrypting with {@code passphrase}. */
    public synchronized Wallet ensureWallet(String alias, char[] passphrase) throws IOException {
        return wallets.containsKey(alias) ? getWallet(alias, passphrase) : createWallet(alias, passphrase);
    }

    /**
     * Returns null for an unknown alias.
     *
     * @throws IllegalStateException if the wallet is encrypted and still locked
     */
    public synchronized Wallet getWallet(String alias) {
        WalletRecord record = wallets.get(alias);
        if (record == null) {
            return null;
        }
        if (record.locked()) {
            throw new IllegalStateException("Wallet '" + alias + "' is encrypted; unlock before use");
        }
        return record.wallet;
    }

    public synchronized Wallet getWallet(String alias, char[] passphrase) throws IOException {
        WalletRecord record = wallets.get(alias);
        if (record == null) {
            return null;
        }
        return record.locked() ? unlockWallet(alias, passphrase) : record.wallet;
    }

    public synchronized boolean isLocked(String alias) {
        WalletRecord record = wallets.get(alias);
        return record != null && record.locked();
    }

    public synchronized List<WalletInfo> listWallets() {
        List<WalletInfo> out = new ArrayList<>(wallets.size());
        for (WalletRecord record : wallets.values()) {
            out.add(new WalletInfo(record.alias, record.address, record.locked()));
        }
        out.sort(Comparator.comparing(WalletInfo::alias));
        return out;
    }

    private WalletRecord requireRecord(String alias) {
        WalletRecord record = wallets.get(alias);
        if (record == null) {
            throw new IllegalArgumentException("Unknown wallet alias: " + alias);
        }
        return record;
    }

    private static void validateAlias(String alias) {
        if (alias.isBlank() || alias.contains("/") || alias.contains("\\") || alias.contains("..")) {
            throw new IllegalArgumentException("Invalid wallet alias: " + alias);
        }
    }

    private static PrivateKey decodePrivateKey(String pem, char[] passphrase) throws GeneralSecurityException {
        KeyFactory factory = KeyFactory.getInstance("EC");
        if (!pem.contains(ENCRYPTED_TYPE)) {
            return factory.generatePrivate(new PKCS8EncodedKeySpec(fromPem("PRIVATE KEY", pem)));
        }
        EncryptedPrivateKeyInfo info;
        try {
            info = new EncryptedPrivateKeyInfo(fromPem(ENCRYPTED_TYPE, pem));
        } catch (IOException e) {
            throw new GeneralSecurityException("Malformed encrypted private key", e);
        }
        SecretKey secretKey = SecretKeyFactory.getInstance(info.getAlgName()).generateSecret(new PBEKeySpec(passphrase));
        Cipher cipher = Cipher.getInstance(info.getAlgName());
        cipher.init(Cipher.DECRYPT_MODE, secretKey, info.getAlgParameters());
        return factory.generatePrivate(new PKCS8EncodedKeySpec(cipher.doFinal(info.getEncryptedData())));
    }

    private byte[] encryptPkcs8(byte[] pkcs8, char[] passphrase) throws GeneralSecurityException {
        GeneralSecurityException last = null;
        for (String algorithm : PBE_ALGORITHMS) {
            try {
                byte[] salt = new byte[SALT_BYTES];
                random.nextBytes(salt);
                SecretKey secretKey = SecretKeyFactory.getInstance(algorithm).generateSecret(new PBEKeySpec(passphrase));
                Cipher cipher = Cipher.getInstance(algorithm);
                cipher.init(Cipher.ENCRYPT_MODE, secretKey, new PBEParameterSpec(salt, ITERATIONS));
                byte[] encrypted = cipher.doFinal(pkcs8);
                try {
                    return new EncryptedPrivateKeyInfo(cipher.getParameters(), encrypted).getEncoded();
                } catch (IOException e) {
                    throw new GeneralSecurityException("Failed to encode encrypted private key", e);
                }
            } catch (GeneralSecurityException e) {
                last = e;
            }
        }
        throw last != null ? last : new GeneralSecurityException("No supported PBE algorithms available");
    }

    private static byte[] fromPem(String type, String pem) {
        String header = "-----BEGIN " + type + "-----";
        String footer = "-----END " + type + "-----";
        String normalized = pem.replace("\r", "").trim();
        int start = normalized.indexOf(header);
        int end = normalized.indexOf(footer);
        if (start < 0 || end < 0) {
            throw new IllegalArgumentException("Invalid PEM encoding for " + type);
        }
        String base64 = normalized.substring(start + header.length(), end).replaceAll("\\s", "");
        return Base64.getDecoder().decode(base64);
    }

    private static String toPem(String type, byte[] der) {
        StringBuilder sb = new StringBuilder();
        String newline = System.lineSeparator();
        sb.append("-----BEGIN ").append(type).append("-----").append(newline);
        String base64 = Base64.getEncoder().encodeToString(der);
        for (int i = 0; i < base64.length(); i += 64) {
            sb.append(base64, i, Math.min(i + 64, base64.length())).append(newline);
        }
        sb.append("-----END ").append(type).append("-----").append(newline);
        return sb.toString();
    }

    public record WalletInfo(String alias, String address, boolean locked) {}

    private static final class WalletRecord {
        final String alias;
        final PublicKey publicKey;
        final String address;
        final Path privatePath;
        final boolean encrypted;
        Wallet wallet;

        WalletRecord(String alias, PublicKey publicKey, String address, Path privatePath,
                     boolean encrypted, Wallet wallet) {
            this.alias = alias;
            this.publicKey = publicKey;
            this.address = address;
            this.privatePath = privatePath;
            this.encrypted = encrypted;
            this.wallet = wallet;
        }

        boolean locked() {
            return encrypted && wallet == null;
        }
    }
}
