/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application;

import com.bocado.application.budget.BudgetTracker;
import com.bocado.application.circuit.CircuitBreakerService;
import com.bocado.application.health.ProviderHealthService;
import com.bocado.domain.model.EndpointClass;
import com.bocado.infrastructure.provider.ProviderErrorType;
import com.bocado.infrastructure.provider.ProviderException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ProviderCallRecorderTest {
    @Mock
    private CircuitBreakerService circuitBreakerService;

    @Mock
    private ProviderHealthService providerHealthService;

    @Mock
    private BudgetTracker budgetTracker;

    @InjectMocks
    private ProviderCallRecorder recorder;

    @Test
    void successSpendsBudgetEvenWhenBreakerWriteFails() {
        doThrow(new DataAccessResourceFailureException("db down"))
                .when(circuitBreakerService).recordSuccess(EndpointClass.PHOTOS);

        recorder.recordSuccess(EndpointClass.PHOTOS, 120, 7);

        verify(providerHealthService).recordCall(EndpointClass.PHOTOS, true, 200, null, 120);
        verify(budgetTracker).recordSpend(EndpointClass.PHOTOS, 7);
    }

    @Test
    void notFoundCountsAsBreakerSuccess() {
        recorder.recordFailure(EndpointClass.PHOTOS,
                new ProviderException(EndpointClass.PHOTOS, ProviderErrorType.NOT_FOUND, 404, "gone"), 50);

        verify(circuitBreakerService).recordSuccess(EndpointClass.PHOTOS);
        verify(circuitBreakerService, never()).recordFailure(EndpointClass.PHOTOS);
        verify(providerHealthService).recordCall(EndpointClass.PHOTOS, true, 404, ProviderErrorType.NOT_FOUND, 50);
        verifyNoInteractions(budgetTracker);
    }

    @Test
    void timeoutCountsAsBreakerFailure() {
        recorder.recordFailure(EndpointClass.PHOTOS, new TimeoutException(), 10_000);

        verify(circuitBreakerService).recordFailure(EndpointClass.PHOTOS);
        verify(providerHealthService).recordCall(eq(EndpointClass.PHOTOS), eq(false), isNull(), eq(ProviderErrorType.TIMEOUT), anyLong());
    }

    @Test
    void classifiesUnknownErrors() {
        assertEquals(ProviderErrorType.UNKNOWN, ProviderCallRecorder.classify(new IllegalStateException()));
        assertEquals(ProviderErrorType.TIMEOUT, ProviderCallRecorder.classify(new TimeoutException()));
    }
}
