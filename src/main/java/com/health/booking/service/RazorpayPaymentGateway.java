package com.health.booking.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.health.booking.dto.PaymentOrder;
import com.health.booking.dto.RefundReceipt;
import com.health.booking.exception.PaymentGatewayException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;

/**
 * Razorpay orders/refunds over its REST API.
 */
@Service
public class RazorpayPaymentGateway implements PaymentGateway {

    private static final Logger log = LoggerFactory.getLogger(RazorpayPaymentGateway.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    @Value("${payment.razorpay.base-url:https://api.razorpay.com/v1}")
    private String baseUrl;

    @Value("${payment.razorpay.key-id:}")
    private String keyId;

    @Value("${payment.razorpay.key-secret:}")
    private String keySecret;

    @Value("${payment.razorpay.checkout-url-template:https://checkout.healthcare.example/pay?order_id=%s}")
    private String checkoutUrlTemplate;

    public RazorpayPaymentGateway(RestTemplateBuilder builder,
                                  @Value("${payment.razorpay.timeout-ms:5000}") long timeoutMs) {
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofMillis(timeoutMs))
                .setReadTimeout(Duration.ofMillis(timeoutMs))
                .build();
    }

    @Override
    public PaymentOrder createOrder(BigDecimal amount, String currency, Long appointmentId) {
        requireCredentials();

        Map<String, Object> body = new HashMap<>();
        body.put("amount", toSubunits(amount));
        body.put("currency", currency);
        body.put("receipt", "appointment-" + appointmentId);
        body.put("notes", Map.of("appointment_id", String.valueOf(appointmentId)));

        JsonNode root = post(baseUrl + "/orders", body, "create order");
        String orderId = root.path("id").asText(null);
        if (StringUtils.isBlank(orderId)) {
            throw new PaymentGatewayException("Gateway returned no order id for appointment " + appointmentId);
        }
        log.info("Created payment order {} for appointment {} ({} {})", orderId, appointmentId, amount, currency);
        return new PaymentOrder(orderId, String.format(checkoutUrlTemplate, orderId));
    }

    @Override
    public RefundReceipt refund(String paymentId, BigDecimal amount, String reason) {
        requireCredentials();
        if (StringUtils.isBlank(paymentId)) {
            throw new PaymentGatewayException("No captured payment to refund");
        }

        Map<String, Object> body = new HashMap<>();
        body.put("amount", toSubunits(amount));
        body.put("notes", Map.of("reason", StringUtils.defaultString(reason)));

        JsonNode root = post(baseUrl + "/payments/" + paymentId + "/refund", body, "refund");
        String refundId = root.path("id").asText(null);
        if (StringUtils.isBlank(refundId)) {
            throw new PaymentGatewayException("Gateway returned no refund id for payment " + paymentId);
        }
        String status = root.path("status").asText("processed");
        log.info("Refund {} issued for payment {} amount={} status={}", refundId, paymentId, amount, status);
        return new RefundReceipt(refundId, status);
    }

    @Override
    public boolean verifySignature(String orderId, String paymentId, String signature) {
        requireCredentials();
        if (StringUtils.isAnyBlank(orderId, paymentId, signature)) {
            return false;
        }
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(keySecret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] expected = mac.doFinal((orderId + "|" + paymentId).getBytes(StandardCharsets.UTF_8));
            byte[] actual = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
            return MessageDigest.isEqual(HexFormat.of().formatHex(expected).getBytes(StandardCharsets.UTF_8), actual);
        } catch (GeneralSecurityException e) {
            throw new PaymentGatewayException("Signature verification unavailable", e);
        }
    }

    private JsonNode post(String url, Map<String, Object> body, String operation) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBasicAuth(keyId, keySecret);
        headers.setContentType(MediaType.APPLICATION_JSON);

        long started = System.currentTimeMillis();
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
            return mapper.readTree(response.getBody());
        } catch (RestClientException | JsonProcessingException e) {
            log.error("Payment gateway {} failed after {} ms: {}", operation, System.currentTimeMillis() - started, e.getMessage());
            throw new PaymentGatewayException("Payment gateway " + operation + " failed", e);
        }
    }

    private void requireCredentials() {
        if (StringUtils.isAnyBlank(keyId, keySecret)) {
            log.error("Razorpay credentials are not set");
            throw new PaymentGatewayException("Payment gateway is not configured");
        }
    }

    private static long toSubunits(BigDecimal amount) {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }
}
