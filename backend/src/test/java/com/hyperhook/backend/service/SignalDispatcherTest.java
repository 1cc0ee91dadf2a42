package com.hyperhook.backend.service;

import com.hyperhook.backend.config.TradingProperties;
import com.hyperhook.backend.dto.EnvelopeStatus;
import com.hyperhook.backend.dto.ResponseEnvelope;
import com.hyperhook.backend.dto.TradeSignal;
import com.hyperhook.backend.exception.ExchangeApiException;
import com.hyperhook.backend.exception.WalletNotConfiguredException;
import com.hyperhook.backend.model.ErrorType;
import com.hyperhook.backend.model.PositionSide;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SignalDispatcherTest {

    private PositionManager positionManager;
    private MetricsService metricsService;
    private SignalDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        positionManager = mock(PositionManager.class);
        metricsService = mock(MetricsService.class);
        dispatcher = new SignalDispatcher(positionManager, new TradingProperties(), metricsService);
    }

    @Test
    void longRoutesToOpenWithParsedPercent() {
        ResponseEnvelope opened = ResponseEnvelope.success("Successfully opened long position for BTC");
        when(positionManager.openPosition("BTC", PositionSide.LONG, 10)).thenReturn(opened);

        ResponseEnvelope response = dispatcher.dispatch(signal("LONG", "BTC", "10"));

        assertThat(response).isSameAs(opened);
        verify(metricsService).recordSignalReceived("LONG");
        verify(metricsService).recordOutcome(EnvelopeStatus.SUCCESS);
    }

    @Test
    void shortUsesDefaultPercentWhenMissing() {
        when(positionManager.openPosition("ETH", PositionSide.SHORT, 5))
                .thenReturn(ResponseEnvelope.success("ok"));

        dispatcher.dispatch(signal("short", "ETH", null));

        verify(positionManager).openPosition("ETH", PositionSide.SHORT, 5);
    }

    @Test
    void integralNumericStringsAreAccepted() {
        when(positionManager.openPosition("BTC", PositionSide.LONG, 25)).thenReturn(ResponseEnvelope.success("ok"));

        dispatcher.dispatch(signal("long", "BTC", "25.0"));

        verify(positionManager).openPosition("BTC", PositionSide.LONG, 25);
    }

    @Test
    void nonNumericPercentIsAValidationError() {
        ResponseEnvelope response = dispatcher.dispatch(signal("long", "BTC", "lots"));

        assertThat(response.getErrorType()).isEqualTo(ErrorType.VALIDATION);
        assertThat(response.getMessage()).isEqualTo("Invalid amountPercent: lots");
        verifyNoInteractions(positionManager);
    }

    @Test
    void fractionalPercentIsRejected() {
        assertThat(dispatcher.dispatch(signal("long", "BTC", "12.5")).isError()).isTrue();
        verifyNoInteractions(positionManager);
    }

    @Test
    void closeRoutesToCloseAll() {
        when(positionManager.closeAllPositions()).thenReturn(ResponseEnvelope.success("No open positions to close"));

        ResponseEnvelope response = dispatcher.dispatch(signal("Close", null, null));

        assertThat(response.getMessage()).isEqualTo("No open positions to close");
        verify(positionManager).closeAllPositions();
    }

    @Test
    void unknownActionIsRejected() {
        ResponseEnvelope response = dispatcher.dispatch(signal("BUY", "BTC", "10"));

        assertThat(response.getStatus()).isEqualTo(EnvelopeStatus.ERROR);
        assertThat(response.getErrorType()).isEqualTo(ErrorType.VALIDATION);
        assertThat(response.getMessage()).isEqualTo("Unknown action: buy");
        verifyNoInteractions(positionManager);
    }

    @Test
    void missingActionIsRejected() {
        assertThat(dispatcher.dispatch(signal(null, "BTC", "10")).getMessage()).isEqualTo("Unknown action: ");
    }

    @Test
    void adapterFaultDuringOpenBecomesErrorEnvelope() {
        when(positionManager.openPosition(any(), any(), anyInt()))
                .thenThrow(new ExchangeApiException("Hyperliquid unreachable"));

        ResponseEnvelope response = dispatcher.dispatch(signal("long", "BTC", "10"));

        assertThat(response.getErrorType()).isEqualTo(ErrorType.EXCHANGE);
        assertThat(response.getMessage()).isEqualTo("Error opening position: Hyperliquid unreachable");
        verify(metricsService).incrementBrokerFailures();
    }

    @Test
    void adapterFaultDuringCloseAllBecomesErrorEnvelope() {
        when(positionManager.closeAllPositions())
                .thenThrow(new WalletNotConfiguredException("HYPERLIQUID_PRIVATE_KEY is not configured"));

        ResponseEnvelope response = dispatcher.dispatch(signal("close", null, null));

        assertThat(response.isError()).isTrue();
        assertThat(response.getMessage())
                .isEqualTo("Error closing all positions: HYPERLIQUID_PRIVATE_KEY is not configured");
    }

    private static TradeSignal signal(String action, String ticker, String percent) {
        return TradeSignal.builder()
                .action(action)
                .ticker(ticker)
                .amountPercent(percent)
                .password("secret")
                .build();
    }
}
