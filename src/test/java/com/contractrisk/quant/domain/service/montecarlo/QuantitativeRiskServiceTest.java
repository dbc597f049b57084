package com.contractrisk.quant.domain.service.montecarlo;

import com.contractrisk.quant.domain.exception.RiskValidationException;
import com.contractrisk.quant.domain.exception.SimulationCancelledException;
import com.contractrisk.quant.domain.exception.UnsupportedDistributionException;
import com.contractrisk.quant.domain.exception.ValidationError;
import com.contractrisk.quant.domain.model.RiskInput;
import com.contractrisk.quant.domain.model.SimulationResult;
import com.contractrisk.quant.domain.model.SimulationResult.PercentileRow;
import com.contractrisk.quant.domain.model.SimulationResult.SensitivityItem;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.within;

class QuantitativeRiskServiceTest {

    private ExecutorService executor;
    private MonteCarloProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private QuantitativeRiskService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        properties = new MonteCarloProperties();
        meterRegistry = new SimpleMeterRegistry();
        service = newService(properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private QuantitativeRiskService newService(MonteCarloProperties props) {
        SimulationEngine engine = new SimulationEngine(new DistributionSampler(), new OccurrenceGate(), executor, props);
        return new QuantitativeRiskService(
                new RiskInputNormalizer(),
                engine,
                new StatisticsAggregator(props),
                new SensitivityAnalyzer(),
                props,
                meterRegistry);
    }

    private static RiskInput riskA() {
        return RiskInput.builder()
                .id("A").riskNumber("R-001").title("Ground conditions")
                .kind("threat")
                .p10(10_000.0).p50(20_000.0).p90(50_000.0)
                .probability(0.5)
                .distributionModel("triangular")
                .build();
    }

    private static RiskInput riskB() {
        return RiskInput.builder()
                .id("B").riskNumber("R-002").title("Steel price escalation")
                .kind("threat")
                .p10(0.0).p50(5_000.0).p90(15_000.0)
                .probability(0.9)
                .distributionModel("normal")
                .build();
    }

    private SimulationResult run(List<RiskInput> risks, Integer iterations, Long seed) {
        return service.simulate(SimulationRequest.builder()
                .risks(risks)
                .iterations(iterations)
                .targetPercentile(80.0)
                .seed(seed)
                .build());
    }

    @Test
    void twoThreatRegisterProducesExpectedShape() {
        SimulationResult result = run(List.of(riskA(), riskB()), 50_000, 1L);

        assertThat(result.getBase()).isEqualTo(25_000.0);
        assertThat(result.getP50()).isBetween(11_500.0, 65_000.0);
        assertThat(result.getP10()).isLessThanOrEqualTo(result.getP50());
        assertThat(result.getP50()).isLessThanOrEqualTo(result.getP90());
        assertThat(result.getTargetPercentile()).isEqualTo(80.0);
        assertThat(result.getTargetValue()).isBetween(result.getP50(), result.getP90());
        assertThat(result.getIterations()).isEqualTo(50_000);
        assertThat(result.getRiskCount()).isEqualTo(2);
        assertThat(result.getSeed()).isEqualTo(1L);
        assertThat(result.isSeedGenerated()).isFalse();
        assertThat(result.getShardCount()).isEqualTo(10);

        SensitivityItem top = result.getSensitivityAnalysis().get(0);
        assertThat(top.getRiskId()).isEqualTo("A");
        assertThat(top.getRiskNumber()).isEqualTo("R-001");
        assertThat(top.getTitle()).isEqualTo("Ground conditions");
    }

    @Test
    void percentileTableIsMonotoneAndMeasuredAgainstBase() {
        SimulationResult result = run(List.of(riskA(), riskB()), 20_000, 5L);

        List<PercentileRow> table = result.getPercentileTable();
        assertThat(table).isNotEmpty();
        for (int i = 1; i < table.size(); i++) {
            assertThat(table.get(i).getValue()).isGreaterThanOrEqualTo(table.get(i - 1).getValue());
        }
        assertThat(table).allSatisfy(row ->
                assertThat(row.getVarianceFromBase()).isEqualTo(row.getValue() - result.getBase()));
        assertThat(result.getDistribution().stream().mapToInt(SimulationResult.HistogramBucket::getCount).sum())
                .isEqualTo(20_000);
    }

    @Test
    void sameSeedIsReproducible() {
        SimulationResult first = run(List.of(riskA(), riskB()), 10_000, 42L);
        SimulationResult second = run(List.of(riskA(), riskB()), 10_000, 42L);

        assertThat(second.getMean()).isEqualTo(first.getMean());
        assertThat(second.getStdDev()).isEqualTo(first.getStdDev());
        assertThat(second.getTargetValue()).isEqualTo(first.getTargetValue());
        assertThat(second.getPercentileTable()).usingRecursiveFieldByFieldElementComparator()
                .containsExactlyElementsOf(first.getPercentileTable());
        assertThat(second.getSensitivityAnalysis()).usingRecursiveFieldByFieldElementComparator()
                .containsExactlyElementsOf(first.getSensitivityAnalysis());
    }

    @Test
    void generatedSeedIsReportedAndReplayable() {
        SimulationResult generated = run(List.of(riskA(), riskB()), 5_000, null);
        SimulationResult replay = run(List.of(riskA(), riskB()), 5_000, generated.getSeed());

        assertThat(generated.isSeedGenerated()).isTrue();
        assertThat(replay.isSeedGenerated()).isFalse();
        assertThat(replay.getMean()).isEqualTo(generated.getMean());
        assertThat(replay.getP90()).isEqualTo(generated.getP90());
    }

    @ParameterizedTest
    @ValueSource(strings = {"triangular", "pert", "normal", "uniform"})
    void degenerateCertainRiskHasNoSpread(String model) {
        RiskInput fixed = RiskInput.builder()
                .id("F").p10(1000.0).p50(1000.0).p90(1000.0)
                .probability(1.0).distributionModel(model)
                .build();

        SimulationResult result = run(List.of(fixed), 7_321, 3L);

        assertThat(result.getMean()).isEqualTo(1000.0);
        assertThat(result.getP10()).isEqualTo(1000.0);
        assertThat(result.getP50()).isEqualTo(1000.0);
        assertThat(result.getP90()).isEqualTo(1000.0);
        assertThat(result.getStdDev()).isZero();
    }

    @Test
    void zeroProbabilityRiskDoesNotChangeSimulatedOutcome() {
        RiskInput dormant = RiskInput.builder()
                .id("Z").p10(100_000.0).p50(200_000.0).p90(900_000.0)
                .probability(0.0).distributionModel("pert")
                .build();

        SimulationResult without = run(List.of(riskA(), riskB()), 20_000, 11L);
        SimulationResult with = run(List.of(riskA(), dormant, riskB()), 20_000, 11L);

        assertThat(with.getBase() - without.getBase()).isEqualTo(200_000.0);
        assertThat(with.getMean()).isEqualTo(without.getMean());
        assertThat(with.getStdDev()).isEqualTo(without.getStdDev());
        assertThat(with.getP10()).isEqualTo(without.getP10());
        assertThat(with.getP50()).isEqualTo(without.getP50());
        assertThat(with.getP90()).isEqualTo(without.getP90());
        assertThat(with.getTargetValue()).isEqualTo(without.getTargetValue());
        assertThat(with.getDistribution()).usingRecursiveFieldByFieldElementComparator()
                .containsExactlyElementsOf(without.getDistribution());

        List<SensitivityItem> withoutDormant = new ArrayList<>(with.getSensitivityAnalysis());
        SensitivityItem last = withoutDormant.remove(withoutDormant.size() - 1);
        assertThat(last.getRiskId()).isEqualTo("Z");
        assertThat(last.getContribution()).isZero();
        assertThat(withoutDormant).usingRecursiveFieldByFieldElementComparator()
                .containsExactlyElementsOf(without.getSensitivityAnalysis());
    }

    @Test
    void opportunitiesReduceTheTotal() {
        RiskInput saving = RiskInput.builder()
                .id("O1").riskNumber("O-01").p10(-1_000.0).p50(-2_000.0).p90(-3_000.0)
                .probability(1.0).distributionModel("uniform")
                .build();

        SimulationResult result = run(List.of(saving), 5_000, 9L);

        assertThat(result.getBase()).isEqualTo(-2_000.0);
        assertThat(result.getMean()).isCloseTo(-2_000.0, within(50.0));
        assertThat(result.getP90()).isLessThan(0.0);
    }

    @Test
    void estimateSpreadShrinksWithMoreIterations() {
        double smallRunSpread = spreadOfMeans(1_000);
        double largeRunSpread = spreadOfMeans(100_000);

        assertThat(largeRunSpread).isLessThan(smallRunSpread);
    }

    private double spreadOfMeans(int iterations) {
        double[] means = new double[8];
        for (int i = 0; i < means.length; i++) {
            means[i] = run(List.of(riskA(), riskB()), iterations, 1_000L + i).getMean();
        }
        return StatisticsAggregator.sampleStdDev(means, StatisticsAggregator.mean(means));
    }

    @Test
    void sensitivityContributionsAreBoundedByTotalVariance() {
        SimulationResult result = run(List.of(riskA(), riskB()), 30_000, 21L);
        double totalVariance = result.getStdDev() * result.getStdDev();

        double sum = result.getSensitivityAnalysis().stream().mapToDouble(SensitivityItem::getContribution).sum();
        assertThat(sum).isGreaterThanOrEqualTo(0.0);
        assertThat(result.getSensitivityAnalysis()).allSatisfy(item ->
                assertThat(item.getContribution()).isLessThanOrEqualTo(totalVariance * (1 + 1e-9)));
    }

    @Test
    void defaultsApplyWhenRunParametersAreOmitted() {
        SimulationResult result = service.simulate(SimulationRequest.builder()
                .risks(List.of(riskA()))
                .seed(4L)
                .build());

        assertThat(result.getIterations()).isEqualTo(properties.getDefaultIterations());
        assertThat(result.getTargetPercentile()).isEqualTo(properties.getDefaultTargetPercentile());
    }

    @Test
    void rejectsBadRunParametersWithAllReasons() {
        RiskValidationException ex = catchThrowableOfType(() -> service.simulate(SimulationRequest.builder()
                .risks(List.of(riskA()))
                .iterations(0)
                .targetPercentile(120.0)
                .build()), RiskValidationException.class);

        assertThat(ex.getErrors()).extracting(ValidationError::field)
                .containsExactly("iterations", "targetPercentile");
        assertThat(meterRegistry.counter("quant.simulation.rejected", "reason", "validation").count())
                .isEqualTo(1.0);
    }

    @Test
    void rejectsIterationCountAboveCeiling() {
        assertThatThrownBy(() -> run(List.of(riskA()), properties.getMaxIterations() + 1, 1L))
                .isInstanceOf(RiskValidationException.class)
                .hasMessageContaining("must not exceed");
    }

    @Test
    void rejectsRunWhoseContributionMatrixWouldExceedCellCap() {
        MonteCarloProperties capped = new MonteCarloProperties();
        capped.setMaxCells(10_000);
        QuantitativeRiskService small = newService(capped);

        RiskValidationException ex = catchThrowableOfType(() -> small.simulate(SimulationRequest.builder()
                .risks(List.of(riskA(), riskB()))
                .iterations(5_001)
                .seed(1L)
                .build()), RiskValidationException.class);

        assertThat(ex.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.field()).isEqualTo("iterations");
            assertThat(error.reason()).contains("5001 x 2 = 10002");
        });
        assertThat(small.simulate(SimulationRequest.builder()
                .risks(List.of(riskA(), riskB()))
                .iterations(5_000)
                .seed(1L)
                .build()).getIterations()).isEqualTo(5_000);
    }

    @Test
    void missingModelIsRejectedRatherThanGuessed() {
        RiskInput unspecified = riskA().toBuilder().distributionModel(null).build();

        RiskValidationException ex = catchThrowableOfType(() -> run(List.of(unspecified), 1_000, 1L),
                RiskValidationException.class);

        assertThat(ex.getErrors()).extracting(ValidationError::field).containsExactly("distributionModel");
    }

    @Test
    void rejectsEmptyRegister() {
        assertThatThrownBy(() -> run(List.of(), 1_000, 1L))
                .isInstanceOf(RiskValidationException.class)
                .hasMessageContaining("at least one risk");
    }

    @Test
    void unsupportedModelIsCountedSeparately() {
        RiskInput lognormal = riskA().toBuilder().distributionModel("lognormal").build();

        assertThatThrownBy(() -> run(List.of(lognormal), 1_000, 1L))
                .isInstanceOf(UnsupportedDistributionException.class);
        assertThat(meterRegistry.counter("quant.simulation.rejected", "reason", "unsupported_distribution").count())
                .isEqualTo(1.0);
    }

    @Test
    void timeoutCancelsTheRun() {
        MonteCarloProperties tight = new MonteCarloProperties();
        tight.setTimeoutMs(1);
        QuantitativeRiskService impatient = newService(tight);

        List<RiskInput> register = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            register.add(riskA().toBuilder().id("A" + i).distributionModel("pert").build());
        }

        assertThatThrownBy(() -> impatient.simulate(SimulationRequest.builder()
                .risks(register)
                .iterations(500_000)
                .seed(1L)
                .build()))
                .isInstanceOf(SimulationCancelledException.class)
                .hasMessageContaining("cancelled");
        assertThat(meterRegistry.counter("quant.simulation.cancelled").count()).isEqualTo(1.0);
    }

    @Test
    void recordsDurationOfSuccessfulRuns() {
        run(List.of(riskA()), 1_000, 1L);

        assertThat(meterRegistry.timer("quant.simulation.duration").count()).isEqualTo(1L);
    }
}
