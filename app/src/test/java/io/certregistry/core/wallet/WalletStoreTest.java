package io.certregistry.core.wallet;

import io.certregistry.core.protocol.RegistryCall;
import io.certregistry.core.protocol.SignatureUtil;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class WalletStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void walletsReloadFromDiskWithSameAddress() throws Exception {
        WalletStore store = new WalletStore(tempDir);
        Wallet created = store.createWallet("owner");
        assertTrue(Files.exists(tempDir.resolve("owner.key")));
        assertTrue(Files.exists(tempDir.resolve("owner.pub")));

        WalletStore reloaded = new WalletStore(tempDir);
        Wallet loaded = reloaded.getWallet("owner");
        assertNotNull(loaded);
        assertEquals(created.getAddress(), loaded.getAddress());

        RegistryCall call = loaded.sign(RegistryCall.revoke("registry-a", loaded.getAddress(), 0, "C-1").build());
        assertTrue(SignatureUtil.verify(call.toUnsignedBytes(), call.signature(), created.getPublicKey()));
    }

    @Test
    void ensureWalletReusesExisting() throws Exception {
        WalletStore store = new WalletStore(tempDir);
        Wallet first = store.ensureWallet("issuer");
        Wallet second = store.ensureWallet("issuer");
        assertSame(first, second);
        assertEquals(1, store.listWallets().size());
        assertEquals("issuer", store.listWallets().get(0).alias());
        assertFalse(store.listWallets().get(0).locked());
    }

    @Test
    void rejectsDuplicateAndUnsafeAliases() throws Exception {
        WalletStore store = new WalletStore(tempDir);
        store.createWallet("a");
        assertThrows(IllegalArgumentException.class, () -> store.createWallet("a"));
        assertThrows(IllegalArgumentException.class, () -> store.createWallet("../escape"));
        assertThrows(IllegalArgumentException.class, () -> store.createWallet(" "));
        assertNull(store.getWallet("missing"));
    }

    @Test
    void passphraseEncryptsKeyAndReloadIsLocked() throws Exception {
        WalletStore store = new WalletStore(tempDir);
        Wallet created = store.createWallet("owner", "correct horse".toCharArray());
        String pem = Files.readString(tempDir.resolve("owner.key"));
        assertTrue(pem.contains("ENCRYPTED PRIVATE KEY"));
        assertFalse(store.isLocked("owner"));

        WalletStore reloaded = new WalletStore(tempDir);
        assertTrue(reloaded.isLocked("owner"));
        assertTrue(reloaded.listWallets().get(0).locked());
        assertThrows(IllegalStateException.class, () -> reloaded.getWallet("owner"));
        assertThrows(IllegalArgumentException.class, () -> reloaded.unlockWallet("owner", "wrong".toCharArray()));
        assertThrows(IllegalArgumentException.class, () -> reloaded.unlockWallet("owner", null));
        assertTrue(reloaded.isLocked("owner"));

        Wallet unlocked = reloaded.unlockWallet("owner", "correct horse".toCharArray());
        assertEquals(created.getAddress(), unlocked.getAddress());
        assertFalse(reloaded.isLocked("owner"));
        assertSame(unlocked, reloaded.getWallet("owner"));

        RegistryCall call = unlocked.sign(RegistryCall.revoke("registry-a", unlocked.getAddress(), 0, "C-1").build());
        assertTrue(SignatureUtil.verify(call.toUnsignedBytes(), call.signature(), created.getPublicKey()));
    }

    @Test
    void ensureWalletUnlocksWithPassphrase() throws Exception {
        char[] passphrase = "s3cret".toCharArray();
        Wallet created = new WalletStore(tempDir).ensureWallet("issuer", passphrase);

        WalletStore reloaded = new WalletStore(tempDir);
        Wallet again = reloaded.ensureWallet("issuer", passphrase);
        assertEquals(created.getAddress(), again.getAddress());
        assertEquals("s3cret", new String(passphrase));
    }

    @Test
    void withoutPassphraseKeyStaysPlain() throws Exception {
        new WalletStore(tempDir).createWallet("plain", new char[0]);
        String pem = Files.readString(tempDir.resolve("plain.key"));
        assertTrue(pem.contains("BEGIN PRIVATE KEY"));
        assertFalse(new WalletStore(tempDir).isLocked("plain"));
    }
}
