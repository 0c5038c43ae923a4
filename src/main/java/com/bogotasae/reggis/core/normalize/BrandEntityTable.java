package com.bogotasae.reggis.core.normalize;

import com.bogotasae.reggis.core.model.LegalEntity;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ordered table of brand tokens that pin a product to a legal entity regardless of the invoice seller.
 * Tokens are matched case-insensitively as substrings of the product name; the first row wins.
 */
public final class BrandEntityTable {

    public record BrandToken(String token, LegalEntity entity) {
    }

    private static final BrandEntityTable DEFAULT = new BrandEntityTable(List.of(
        new BrandToken("PARMALAT", LegalEntity.LACTALIS),
        new BrandToken("PROLECHE", LegalEntity.PROLECHE)
    ));

    private final List<BrandToken> tokens;

    public BrandEntityTable(List<BrandToken> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    public static BrandEntityTable defaults() {
        return DEFAULT;
    }

    public Optional<LegalEntity> match(String productName) {
        if (productName == null || productName.isBlank()) {
            return Optional.empty();
        }
        String upper = productName.toUpperCase(Locale.ROOT);
        for (BrandToken row : tokens) {
            if (upper.contains(row.token().toUpperCase(Locale.ROOT))) {
                return Optional.of(row.entity());
            }
        }
        return Optional.empty();
    }

    /**
     * Tax ID used for material lookups: the brand's entity when the name carries a token, else the seller.
     */
    public String effectiveEntityTaxId(String productName, String sellerTaxId) {
        return match(productName)
            .map(LegalEntity::taxId)
            .orElse(sellerTaxId == null ? "" : sellerTaxId.trim());
    }
}
