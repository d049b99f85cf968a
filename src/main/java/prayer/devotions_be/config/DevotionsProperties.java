package prayer.devotions_be.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "devotions")
public class DevotionsProperties {
    /** Zone that decides "today" for calendar pages and the Lent gate, e.g. America/New_York */
    @NotBlank
    private String homeTimezone = "America/New_York";
    /** Public site URL prefixed to devotion links in email and SMS */
    @NotBlank
    private String baseUrl = "https://www.asimplewaytopray.com";
    /** Classpath location of the observance registry JSON */
    @NotBlank
    private String observanceResource = "liturgy/liturgical_year.json";
    /** Classpath location of the daily lectionary JSON */
    @NotBlank
    private String lectionaryResource = "liturgy/daily_lectionary.json";

    public String getHomeTimezone() { return homeTimezone; }
    public void setHomeTimezone(String homeTimezone) { this.homeTimezone = homeTimezone; }
    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    public String getObservanceResource() { return observanceResource; }
    public void setObservanceResource(String observanceResource) { this.observanceResource = observanceResource; }
    public String getLectionaryResource() { return lectionaryResource; }
    public void setLectionaryResource(String lectionaryResource) { this.lectionaryResource = lectionaryResource; }
}
