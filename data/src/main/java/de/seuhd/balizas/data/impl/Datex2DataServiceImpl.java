package de.seuhd.balizas.data.impl;

import de.seuhd.balizas.data.config.Datex2Properties;
import de.seuhd.balizas.domain.exceptions.Datex2FetchException;
import de.seuhd.balizas.domain.ports.Datex2DataService;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NonNull;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * DATEX2 retrieval service reading from the DGT endpoint or from local files.
 */
@Service
@Slf4j
class Datex2DataServiceImpl implements Datex2DataService {
    private final RestTemplate restTemplate;
    private final Datex2Properties properties;

    public Datex2DataServiceImpl(RestTemplate restTemplate, Datex2Properties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public byte @NonNull [] fetch() throws Datex2FetchException {
        String url = properties.url();
        log.info("Downloading DATEX2 publication from {}...", url);

        try {
            HttpHeaders headers = new HttpHeaders();
            headers.set(HttpHeaders.ACCEPT, "application/xml, text/xml, */*");
            HttpEntity<?> entity = new HttpEntity<>(headers);

            ResponseEntity<byte[]> response = restTemplate.exchange(url, HttpMethod.GET, entity, byte[].class);
            byte[] body = response.getBody();

            if (!response.getStatusCode().is2xxSuccessful()) {
                log.error("Failed to download DATEX2 publication: HTTP status {}", response.getStatusCode());
                throw new Datex2FetchException(url, "HTTP status " + response.getStatusCode());
            }
            if (body == null || body.length == 0) {
                log.error("DATEX2 endpoint returned an empty body");
                throw new Datex2FetchException(url, "empty response body");
            }

            log.info("Downloaded DATEX2 publication ({} bytes)", body.length);
            return body;
        } catch (RestClientException e) {
            log.error("Error downloading DATEX2 publication from {}: {}", url, e.getMessage());
            throw new Datex2FetchException(url, e);
        }
    }

    @Override
    public byte @NonNull [] load(@NonNull Path file) throws Datex2FetchException {
        log.info("Reading DATEX2 publication from {}...", file);
        try {
            byte[] content = Files.readAllBytes(file);
            log.info("Read DATEX2 publication ({} bytes)", content.length);
            return content;
        } catch (IOException e) {
            log.error("Error reading DATEX2 publication from {}: {}", file, e.getMessage());
            throw new Datex2FetchException(file.toString(), e);
        }
    }
}
