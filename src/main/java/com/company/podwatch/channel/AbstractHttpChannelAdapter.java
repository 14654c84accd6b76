package com.company.podwatch.channel;

import com.company.podwatch.domain.AlertDestination;
import com.company.podwatch.domain.enums.ChannelType;
import com.company.podwatch.exception.ChannelDeliveryException;
import com.company.podwatch.settings.DestinationSettings;
import com.company.podwatch.settings.HttpChannelTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * JSON-over-HTTP channel with bearer token authentication. 5xx, timeouts and I/O errors are
 * transient; 4xx and malformed requests are not.
 */
@Slf4j
public abstract class AbstractHttpChannelAdapter implements ChannelAdapter {

    private final RestTemplate restTemplate;

    protected AbstractHttpChannelAdapter(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * Request body for one message to one destination
     */
    protected abstract Map<String, Object> buildPayload(AlertDestination destination, AlertMessage message,
                                                        HttpChannelTransport transport);

    @Override
    public boolean isConfigured(DestinationSettings settings) {
        HttpChannelTransport transport = settings.httpTransport(getChannelType());
        return transport != null && transport.isConfigured();
    }

    @Override
    public void send(AlertDestination destination, AlertMessage message, DestinationSettings settings) {
        ChannelType channel = getChannelType();
        HttpChannelTransport transport = settings.httpTransport(channel);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (transport.getApiToken() != null && !transport.getApiToken().isBlank()) {
            headers.setBearerAuth(transport.getApiToken());
        }
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(buildPayload(destination, message, transport), headers);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(transport.getApiUrl(), request, String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new ChannelDeliveryException(channel,
                        "Unexpected response status " + response.getStatusCode().value(), false);
            }
            log.debug("Alert {} delivered via {} to {}", message.getAlertId(), channel, destination.getId());
        } catch (HttpServerErrorException e) {
            throw new ChannelDeliveryException(channel, "Server error " + e.getStatusCode().value(), true, e);
        } catch (HttpClientErrorException e) {
            throw new ChannelDeliveryException(channel, "Request rejected with " + e.getStatusCode().value(), false, e);
        } catch (ResourceAccessException e) {
            throw new ChannelDeliveryException(channel, "I/O error: " + e.getMessage(), true, e);
        } catch (RestClientException e) {
            throw new ChannelDeliveryException(channel, "HTTP call failed: " + e.getMessage(), true, e);
        } catch (IllegalArgumentException e) {
            throw new ChannelDeliveryException(channel, "Invalid endpoint: " + e.getMessage(), false, e);
        }
    }
}
