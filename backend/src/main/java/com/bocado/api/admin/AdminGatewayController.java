/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.api.admin;

import com.bocado.application.budget.BudgetTracker;
import com.bocado.application.circuit.CircuitBreakerService;
import com.bocado.domain.model.BudgetStatus;
import com.bocado.domain.model.CircuitBreakerSnapshot;
import com.bocado.domain.model.EndpointClass;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/admin/gateway")
public class AdminGatewayController {
    private final CircuitBreakerService circuitBreakerService;
    private final BudgetTracker budgetTracker;

    public AdminGatewayController(CircuitBreakerService circuitBreakerService, BudgetTracker budgetTracker) {
        this.circuitBreakerService = circuitBreakerService;
        this.budgetTracker = budgetTracker;
    }

    @GetMapping("/circuits")
    public List<CircuitBreakerSnapshot> circuits() {
        return circuitBreakerService.states();
    }

    @PostMapping("/circuits/{endpointClass}/reset")
    public CircuitBreakerSnapshot reset(@PathVariable("endpointClass") String endpointClass) {
        return circuitBreakerService.reset(EndpointClass.fromKey(endpointClass));
    }

    @GetMapping("/budgets")
    public List<BudgetView> budgets() {
        return budgetTracker.statuses().stream().map(BudgetView::from).toList();
    }

    public record BudgetView(
            String endpointClass,
            long spent,
            long limit,
            long remaining,
            boolean ok,
            String windowStart,
            String windowEnd
    ) {
        static BudgetView from(BudgetStatus status) {
            return new BudgetView(
                    status.endpointClass().key(),
                    status.spent(),
                    status.limit(),
                    status.remaining(),
                    status.ok(),
                    status.windowStart().toString(),
                    status.windowEnd().toString()
            );
        }
    }
}
