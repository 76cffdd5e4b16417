package de.seuhd.balizas.data.config;

import org.jspecify.annotations.NonNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Configuration of the DATEX2 source.
 *
 * @param url Endpoint publishing the current situation publication.
 * @param timeout Connect and read timeout for the endpoint.
 * @param localFile File used when the payload is loaded locally.
 */
@ConfigurationProperties(prefix = "balizas.datex2")
public record Datex2Properties(
        @DefaultValue("https://nap.dgt.es/datex2/v3/dgt/SituationPublication/datex2_v36.xml") @NonNull String url,
        @DefaultValue("30s") @NonNull Duration timeout,
        @DefaultValue("datex2_v36.xml") @NonNull String localFile
) {
}
