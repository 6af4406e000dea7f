package uk.gegc.bannertracking.features.banner.domain.model;

/**
 * What is known about the recipient a banner is evaluated for. Any attribute may be null,
 * in which case the matching targeting facet is not evaluated.
 */
public record RecipientContext(
        String department,
        String device,
        String geo,
        String audience
) {

    private static final RecipientContext ANONYMOUS = new RecipientContext(null, null, null, null);

    public static RecipientContext anonymous() {
        return ANONYMOUS;
    }
}
