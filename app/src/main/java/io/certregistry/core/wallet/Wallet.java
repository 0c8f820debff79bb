package io.certregistry.core.wallet;

import io.certregistry.core.protocol.RegistryCall;
import io.certregistry.core.protocol.SignatureUtil;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;

/** EC key pair of one principal; its address is derived from the public key. */
public class Wallet {
    static final int KEY_SIZE = 256;

    private final KeyPair keyPair;
    private final String address;

    public Wallet(KeyPair keyPair) {
        this.keyPair = keyPair;
        this.address = SignatureUtil.deriveAddress(keyPair.getPublic());
    }

    /** Fresh, unsaved key pair. */
    public static Wallet generate() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(KEY_SIZE);
            return new Wallet(generator.generateKeyPair());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("EC key generation unavailable", e);
        }
    }

    public String getAddress() {
        return address;
    }

    public PrivateKey getPrivateKey() {
        return keyPair.getPrivate();
    }

    public PublicKey getPublicKey() {
        return keyPair.getPublic();
    }

    public byte[] sign(byte[] data) {
        return SignatureUtil.sign(data, getPrivateKey());
    }

    /** Sign an unsigned call built for this wallet's address. */
    public RegistryCall sign(RegistryCall unsigned) {
        if (!address.equals(unsigned.caller())) {
            throw new IllegalArgumentException("Call caller " + unsigned.caller() + " is not " + address);
        }
        return unsigned.signed(sign(unsigned.toUnsignedBytes()), getPublicKey());
    }
}
