package dev.screener.model;

/**
 * Contact details found in a candidate document. Any field may be null.
 */
public record ContactInfo(String email, String phone, String linkedin, String github) {

    private static final ContactInfo NONE = new ContactInfo(null, null, null, null);

    public static ContactInfo none() {
        return NONE;
    }

    /**
     * Keep the given e-mail when present, otherwise the one found in the text.
     */
    public ContactInfo preferEmail(String suppliedEmail) {
        if (suppliedEmail == null || suppliedEmail.isBlank()) {
            return this;
        }
        return new ContactInfo(suppliedEmail.trim(), phone, linkedin, github);
    }
}
