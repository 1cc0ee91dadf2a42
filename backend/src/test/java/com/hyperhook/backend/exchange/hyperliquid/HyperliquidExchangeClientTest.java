package com.hyperhook.backend.exchange.hyperliquid;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hyperhook.backend.config.HyperliquidProperties;
import com.hyperhook.backend.exception.WalletNotConfiguredException;
import com.hyperhook.backend.model.AssetMetadata;
import com.hyperhook.backend.model.OrderRequest;
import com.hyperhook.backend.model.OrderResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HyperliquidExchangeClientTest {

    private final HyperliquidHttpClient httpClient = mock(HyperliquidHttpClient.class);
    private final HyperliquidResponseDecoder decoder = mock(HyperliquidResponseDecoder.class);

    @Test
    void missingKeyFailsAtCallTimeNotAtStartup() {
        HyperliquidExchangeClient client = client(new HyperliquidProperties());

        assertThatThrownBy(client::accountAddress)
                .isInstanceOf(WalletNotConfiguredException.class)
                .hasMessageContaining("HYPERLIQUID_PRIVATE_KEY");
    }

    @Test
    void invalidKeyFailsFast() {
        HyperliquidProperties properties = new HyperliquidProperties();
        properties.setPrivateKey("0xdeadbeef");

        assertThatThrownBy(() -> client(properties)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void noncesStrictlyIncrease() {
        HyperliquidExchangeClient client = client(new HyperliquidProperties());

        long previous = client.nextNonce();
        for (int i = 0; i < 1000; i++) {
            long next = client.nextNonce();
            assertThat(next).isGreaterThan(previous);
            previous = next;
        }
    }

    @Test
    void unknownAssetIsRejectedWithoutSigning() {
        when(httpClient.postInfo(anyString())).thenReturn("{}");
        when(decoder.decodeMeta("{}")).thenReturn(List.of(new AssetMetadata("BTC", 50, 5, 0)));
        HyperliquidExchangeClient client = client(new HyperliquidProperties());

        OrderResult result = client.submitMarketOrder(
                OrderRequest.marketOpen("DOGE", true, BigDecimal.ONE, null));

        assertThat(result.isOk()).isFalse();
        assertThat(result.errorDetail()).isEqualTo("Unknown asset DOGE");
        verify(httpClient, never()).postExchange(anyString());
    }

    private HyperliquidExchangeClient client(HyperliquidProperties properties) {
        return new HyperliquidExchangeClient(httpClient, decoder, properties, new ObjectMapper());
    }
}
