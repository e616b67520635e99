package com.smurthy.ai.agri.agents;

import com.smurthy.ai.agri.model.Horizon;
import com.smurthy.ai.agri.model.Outcome;
import com.smurthy.ai.agri.model.Priority;
import com.smurthy.ai.agri.model.Query;
import com.smurthy.ai.agri.model.Recommendation;
import com.smurthy.ai.agri.model.SpecialistResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FinanceAgentTest {

    private final FinanceAgent financeAgent = new FinanceAgent();

    @Test
    @DisplayName("Small holdings should only see collateral-free products")
    void testSmallFarmerLoans() {
        assertThat(FinanceAgent.loanOptions("small", 1.5)).extracting(FinanceAgent.LoanOption::name)
                .containsExactly("Kisan Credit Card (KCC)", "PM-KISAN", "Microfinance Loan");
    }

    @Test
    @DisplayName("Medium farms of 2-10 ha should see bank credit")
    void testMediumFarmerLoans() {
        assertThat(FinanceAgent.loanOptions("medium", 5)).extracting(FinanceAgent.LoanOption::name)
                .containsExactly("Kisan Credit Card (KCC)", "Agricultural Term Loan");
    }

    @Test
    @DisplayName("Everyone else should see every loan")
    void testOtherLoans() {
        assertThat(FinanceAgent.loanOptions("large", 20)).hasSize(4);
        assertThat(FinanceAgent.loanOptions("small", 3)).hasSize(4);
    }

    @Test
    @DisplayName("State schemes should be appended to the central ones")
    void testSchemes() {
        assertThat(FinanceAgent.governmentSchemes("Punjab")).hasSize(5)
                .last().extracting(FinanceAgent.Scheme::name).isEqualTo("Punjab Kisan Vikas Yojana");
        assertThat(FinanceAgent.governmentSchemes("Goa")).hasSize(4);
    }

    @Test
    @DisplayName("Loan eligibility should multiply land, farmer type and credit factors")
    void testLoanEligibility() {
        assertThat(FinanceAgent.loanEligibility("small", 2.0, "good").eligibleAmount()).isEqualTo("₹80,000");
        assertThat(FinanceAgent.loanEligibility("medium", 4.0, "excellent").eligibleAmountInr())
                .isCloseTo(240_000.0, within(0.01));
        assertThat(FinanceAgent.loanEligibility("large", 10.0, "poor").eligibleAmount()).isEqualTo("₹420,000");
    }

    @Test
    @DisplayName("Unknown crops should have an Unknown market trend")
    void testUnknownTrend() {
        assertThat(FinanceAgent.marketTrend("Saffron").trend()).isEqualTo("Unknown");
        assertThat(FinanceAgent.marketTrend("Wheat").trend()).isEqualTo("Rising");
    }

    @Test
    @DisplayName("Should build a finance answer with defaults")
    void testInvokeWithDefaults() {
        // When
        SpecialistResult result = financeAgent.invoke(Query.of("What loan can I get?"), Map.of());

        // Then
        assertThat(result.outcome()).isEqualTo(Outcome.SUCCESS);
        assertThat(result.confidence()).isCloseTo(0.6, within(1e-9));
        assertThat(result.payload()).containsKeys("loan_options", "government_schemes", "market_analysis",
                "insurance_options", "loan_eligibility");
        FinanceAgent.LoanEligibility eligibility = (FinanceAgent.LoanEligibility) result.payload().get("loan_eligibility");
        assertThat(eligibility.eligibleAmount()).isEqualTo("₹80,000");
        assertThat(result.recommendations()).extracting(Recommendation::horizon).containsExactly(
                Horizon.IMMEDIATE_ACTION, Horizon.SHORT_TERM_PLAN, Horizon.RISK_MITIGATION,
                Horizon.LONG_TERM_STRATEGY);
    }

    @Test
    @DisplayName("Market signals of the farmer's crop should become recommendations")
    void testMarketRecommendations() {
        // When
        SpecialistResult wheat = financeAgent.invoke(Query.of("wheat prices"),
                Map.of(Query.CROP_TYPE, "Wheat", Query.FARMER_TYPE, "medium", Query.LAND_AREA, "4"));
        SpecialistResult cotton = financeAgent.invoke(Query.of("cotton prices"),
                Map.of(Query.CROP_TYPE, "Cotton", Query.FARMER_TYPE, "medium"));

        // Then
        List<Recommendation> wheatAdvice = wheat.recommendations();
        assertThat(wheatAdvice).anySatisfy(r -> {
            assertThat(r.horizon()).isEqualTo(Horizon.OPPORTUNITY);
            assertThat(r.text()).startsWith("Wheat prices are rising");
        });
        assertThat(wheatAdvice).noneMatch(r -> r.horizon() == Horizon.IMMEDIATE_ACTION);
        assertThat(cotton.recommendations()).anySatisfy(r -> {
            assertThat(r.horizon()).isEqualTo(Horizon.RISK_MITIGATION);
            assertThat(r.priority()).isEqualTo(Priority.MEDIUM);
            assertThat(r.text()).contains("falling");
        });
    }
}
