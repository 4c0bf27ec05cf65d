package io.fanout;

import java.util.Objects;

/**
 * VAPID signing details identifying the application server to a web push service.
 *
 * @param subject    contact URI, usually {@code mailto:} followed by an address
 * @param publicKey  application server public key (URL-safe base64)
 * @param privateKey application server private key (URL-safe base64)
 */
public record VapidDetails(String subject, String publicKey, String privateKey) {

    public VapidDetails {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(publicKey, "publicKey");
        Objects.requireNonNull(privateKey, "privateKey");
    }

    /**
     * Creates details whose subject is {@code mailto:<contactEmail>}.
     *
     * @param contactEmail contact address of the sender
     * @param publicKey    application server public key
     * @param privateKey   application server private key
     * @return the signing details
     */
    public static VapidDetails forContact(String contactEmail, String publicKey, String privateKey) {
        Objects.requireNonNull(contactEmail, "contactEmail");
        return new VapidDetails("mailto:" + contactEmail, publicKey, privateKey);
    }

    @Override
    public String toString() {
        return "VapidDetails{subject=" + subject + ", publicKey=" + publicKey + "}";
    }
}
