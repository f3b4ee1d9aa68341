package com.merchandise.inventory.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Import and sync settings
 *
 * Usage in application.yml:
 * inventory:
 *   import-settings:
 *     price-source: IMPORT_EXCEL
 *   sync:
 *     price-source: INVENTORY_SYNC
 *     error-column: SyncError
 *     locale: en
 */
@Configuration
@ConfigurationProperties(prefix = "inventory")
@Data
public class ImportProperties {

    private ImportSettings importSettings = new ImportSettings();
    private SyncSettings sync = new SyncSettings();

    @Data
    public static class ImportSettings {
        private String priceSource = "IMPORT_EXCEL";
    }

    @Data
    public static class SyncSettings {
        private String priceSource = "INVENTORY_SYNC";
        private String errorColumn = "SyncError";
        private Locale locale = Locale.ENGLISH;
    }

    // Convenience methods
    public String getImportPriceSource() {
        return importSettings.getPriceSource();
    }

    public String getSyncPriceSource() {
        return sync.getPriceSource();
    }

    public String getSyncErrorColumn() {
        return sync.getErrorColumn();
    }

    public Locale getMessageLocale() {
        return sync.getLocale();
    }
}
