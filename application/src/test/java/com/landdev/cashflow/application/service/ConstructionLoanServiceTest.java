package com.landdev.cashflow.application.service;

import com.landdev.cashflow.application.engine.debt.InterestReserveSolver;
import com.landdev.cashflow.application.engine.debt.LoanTermsResolver;
import com.landdev.cashflow.application.engine.debt.RevolverScheduler;
import com.landdev.cashflow.domain.enums.StructureType;
import com.landdev.cashflow.domain.exception.NotFoundException;
import com.landdev.cashflow.domain.exception.ValidationException;
import com.landdev.cashflow.domain.model.Loan;
import com.landdev.cashflow.domain.model.LoanSchedule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConstructionLoanServiceTest {

    @Mock
    private ProjectInputLoader inputLoader;

    private ConstructionLoanService service;
    private ProjectInputs inputs;

    @BeforeEach
    void setUp() {
        ProjectionService projectionService = ProjectFixtures.projectionService(inputLoader, new SimpleMeterRegistry());
        service = new ConstructionLoanService(projectionService, new LoanTermsResolver(),
                new RevolverScheduler(new InterestReserveSolver(15, 1.0)));
        inputs = ProjectFixtures.inputs();
        when(inputLoader.load(ProjectFixtures.PROJECT_ID)).thenReturn(inputs);
    }

    @Test
    void testScheduleRevolver() {
        LoanSchedule schedule = service.schedule(ProjectFixtures.PROJECT_ID, ProjectFixtures.REVOLVER_ID);

        assertEquals(StructureType.REVOLVER, schedule.getStructureType());
        assertEquals(24, schedule.getPeriods().size());
        assertTrue(schedule.isConverged());
        assertTrue(schedule.getCommitment() > 0);
        assertEquals(schedule.getCommitment() - schedule.getOriginationFee() - schedule.getInterestReserve()
                - schedule.getClosingCosts(), schedule.getNetProceeds(), 1e-6);
        assertTrue(schedule.getTotalReleasePayments() > 0);
    }

    @Test
    void testUnknownLoan() {
        assertThrows(NotFoundException.class, () -> service.schedule(ProjectFixtures.PROJECT_ID, 42L));
    }

    @Test
    void testTermLoanRejected() {
        inputs.getLoans().add(Loan.builder().loanId(2L).structureType(StructureType.TERM)
                .loanAmount(1_000_000.0).loanTermYears(1).build());

        assertThrows(ValidationException.class, () -> service.schedule(ProjectFixtures.PROJECT_ID, 2L));
    }
}
