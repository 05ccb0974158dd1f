package com.ryuqq.recon.adapter.runner;

import com.ryuqq.recon.core.model.ScanId;
import com.ryuqq.recon.core.orchestrator.ScanOrchestrator;
import com.ryuqq.recon.core.phase.ScanPhase;
import com.ryuqq.recon.core.statemachine.ScanState;
import com.ryuqq.recon.core.statemachine.ScanStateMachine;
import com.ryuqq.recon.core.statemachine.StateTransition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * PhasedScanRunner 유닛 테스트.
 *
 * <p>PhasedScanRunner의 핵심 동작을 검증합니다:</p>
 * <ul>
 *   <li>정상 실행: CREATED → ... → COMPLETED, 단계별 디스패치</li>
 *   <li>실패 처리: 모듈 예외, 충족 불가능한 의존성, 실행 로직 누락</li>
 *   <li>동시 실행 수 제한</li>
 *   <li>모듈/스캔 타임아웃</li>
 *   <li>외부 제어: PAUSED, STOPPING</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class PhasedScanRunnerTest {

    private static final ScanId SCAN_ID = ScanId.of("scan-runner-001");

    @Mock
    private ModuleTask dnsTask;

    @Mock
    private ModuleTask whoisTask;

    @Mock
    private ModuleTask portscanTask;

    private ScanStateMachine machine;
    private ScanOrchestrator orchestrator;
    private ModuleRunnerConfig config;
    private PhasedScanRunner runner;
    private ExecutorService background;

    @BeforeEach
    void setUp() {
        machine = new ScanStateMachine(SCAN_ID);
        orchestrator = new ScanOrchestrator(SCAN_ID, "example.com");
        config = new ModuleRunnerConfig().withPollingIntervalMs(10);
        background = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        background.shutdownNow();
        if (runner != null) {
            runner.shutdown();
        }
    }

    // ============================================================
    // 1. 정상 실행
    // ============================================================

    @Test
    void run_모든_단계를_거쳐_COMPLETED로_종료됨() throws Exception {
        // given
        orchestrator
            .registerModule("sfp_dns", ScanPhase.DISCOVERY, 10)
            .registerModule("sfp_whois", ScanPhase.DISCOVERY, 1)
            .registerModule("sfp_portscan", ScanPhase.ENUMERATION, 0, Set.of("sfp_dns"));
        when(dnsTask.execute(any())).thenReturn(5L);
        when(whoisTask.execute(any())).thenReturn(2L);
        when(portscanTask.execute(any())).thenReturn(11L);

        runner = new PhasedScanRunner(machine, orchestrator,
            Map.of("sfp_dns", dnsTask, "sfp_whois", whoisTask, "sfp_portscan", portscanTask), config);

        // when
        ScanState result = runner.run();

        // then
        assertThat(result).isEqualTo(ScanState.COMPLETED);
        assertThat(machine.getHistory()).extracting(StateTransition::toState).containsExactly(
            ScanState.QUEUED, ScanState.STARTING, ScanState.RUNNING, ScanState.COMPLETED
        );
        assertThat(orchestrator.getCurrentPhase()).isEqualTo(ScanPhase.COMPLETE);
        assertThat(orchestrator.getTotalEvents()).isEqualTo(18);
        assertThat(orchestrator.getTotalErrors()).isZero();

        ArgumentCaptor<ModuleContext> captor = ArgumentCaptor.forClass(ModuleContext.class);
        verify(portscanTask, times(1)).execute(captor.capture());
        assertThat(captor.getValue().target()).isEqualTo("example.com");
        assertThat(captor.getValue().phase()).isEqualTo(ScanPhase.ENUMERATION);
        assertThat(captor.getValue().scanId()).isEqualTo(SCAN_ID);
    }

    @Test
    void run_같은_단계의_의존_모듈은_선행_모듈_완료_후에_실행됨() {
        // given
        List<String> order = new CopyOnWriteArrayList<>();
        orchestrator
            .registerModule("sfp_b", ScanPhase.DISCOVERY, 10, Set.of("sfp_a"))
            .registerModule("sfp_a", ScanPhase.DISCOVERY, 0);
        Map<String, ModuleTask> tasks = new HashMap<>();
        tasks.put("sfp_a", context -> {
            Thread.sleep(30);
            order.add(context.moduleName());
            return 1;
        });
        tasks.put("sfp_b", context -> {
            order.add(context.moduleName());
            return 1;
        });
        runner = new PhasedScanRunner(machine, orchestrator, tasks, config.withConcurrency(4));

        // when
        ScanState result = runner.run();

        // then
        assertThat(result).isEqualTo(ScanState.COMPLETED);
        assertThat(order).containsExactly("sfp_a", "sfp_b");
    }

    @Test
    void run_RUNNING_상태에서_시작해도_동작함() throws Exception {
        // given
        machine = new ScanStateMachine(SCAN_ID, ScanState.RUNNING);
        orchestrator.registerModule("sfp_dns", ScanPhase.DISCOVERY);
        when(dnsTask.execute(any())).thenReturn(0L);
        runner = new PhasedScanRunner(machine, orchestrator, Map.of("sfp_dns", dnsTask), config);

        // when & then
        assertThat(runner.run()).isEqualTo(ScanState.COMPLETED);
        assertThat(machine.getHistory()).hasSize(1);
    }

    // ============================================================
    // 2. 실패 처리
    // ============================================================

    @Test
    void run_모듈_예외는_모듈만_실패시키고_의존_모듈은_충족_불가로_실패함() throws Exception {
        // given
        orchestrator
            .registerModule("sfp_dns", ScanPhase.DISCOVERY)
            .registerModule("sfp_whois", ScanPhase.DISCOVERY)
            .registerModule("sfp_portscan", ScanPhase.ENUMERATION, 0, Set.of("sfp_dns"));
        when(dnsTask.execute(any())).thenThrow(new IOException("resolver down"));
        when(whoisTask.execute(any())).thenReturn(3L);

        runner = new PhasedScanRunner(machine, orchestrator,
            Map.of("sfp_dns", dnsTask, "sfp_whois", whoisTask, "sfp_portscan", portscanTask), config);

        // when
        ScanState result = runner.run();

        // then
        assertThat(result).isEqualTo(ScanState.COMPLETED);
        assertThat(orchestrator.getModuleStatus("sfp_dns")).isEqualTo("failed");
        assertThat(orchestrator.getModule("sfp_dns").orElseThrow().lastError()).isEqualTo("resolver down");
        assertThat(orchestrator.getModuleStatus("sfp_portscan")).isEqualTo("failed");
        assertThat(orchestrator.getModule("sfp_portscan").orElseThrow().lastError())
            .startsWith(PhasedScanRunner.UNSATISFIED_DEPENDENCIES)
            .contains("sfp_dns");
        assertThat(orchestrator.getTotalErrors()).isEqualTo(2);
        assertThat(orchestrator.getTotalEvents()).isEqualTo(3);
        verify(portscanTask, never()).execute(any());
    }

    @Test
    void run_순환_의존성은_충족_불가로_실패함() {
        // given
        orchestrator
            .registerModule("sfp_x", ScanPhase.ANALYSIS, 0, Set.of("sfp_y"))
            .registerModule("sfp_y", ScanPhase.ANALYSIS, 0, Set.of("sfp_x"));
        runner = new PhasedScanRunner(machine, orchestrator,
            Map.of("sfp_x", context -> 1, "sfp_y", context -> 1), config);

        // when
        ScanState result = runner.run();

        // then
        assertThat(result).isEqualTo(ScanState.COMPLETED);
        assertThat(orchestrator.getModuleStatus("sfp_x")).isEqualTo("failed");
        assertThat(orchestrator.getModuleStatus("sfp_y")).isEqualTo("failed");
    }

    @Test
    void run_실행_로직이_없는_모듈은_실패_처리됨() {
        // given
        orchestrator.registerModule("sfp_orphan", ScanPhase.DISCOVERY);
        runner = new PhasedScanRunner(machine, orchestrator, Map.of(), config);

        // when
        ScanState result = runner.run();

        // then
        assertThat(result).isEqualTo(ScanState.COMPLETED);
        assertThat(orchestrator.getModule("sfp_orphan").orElseThrow().lastError()).isEqualTo(PhasedScanRunner.NO_TASK);
    }

    @Test
    void run_음수_이벤트_수를_보고한_모듈은_실패함() {
        // given
        orchestrator.registerModule("sfp_bad", ScanPhase.DISCOVERY);
        runner = new PhasedScanRunner(machine, orchestrator, Map.of("sfp_bad", context -> -1), config);

        // when
        runner.run();

        // then
        assertThat(orchestrator.getModuleStatus("sfp_bad")).isEqualTo("failed");
        assertThat(orchestrator.getTotalEvents()).isZero();
    }

    // ============================================================
    // 3. 동시 실행 수 제한
    // ============================================================

    @Test
    void run_동시_실행_모듈_수는_concurrency를_넘지_않음() {
        // given
        AtomicInteger current = new AtomicInteger();
        AtomicInteger max = new AtomicInteger();
        ModuleTask tracked = context -> {
            int now = current.incrementAndGet();
            max.accumulateAndGet(now, Math::max);
            Thread.sleep(40);
            current.decrementAndGet();
            return 1;
        };
        Map<String, ModuleTask> tasks = new HashMap<>();
        for (int i = 0; i < 6; i++) {
            orchestrator.registerModule("sfp_" + i, ScanPhase.DISCOVERY);
            tasks.put("sfp_" + i, tracked);
        }
        runner = new PhasedScanRunner(machine, orchestrator, tasks, config.withConcurrency(2));

        // when
        ScanState result = runner.run();

        // then
        assertThat(result).isEqualTo(ScanState.COMPLETED);
        assertThat(max.get()).isBetween(1, 2);
        assertThat(orchestrator.getTotalEvents()).isEqualTo(6);
    }

    // ============================================================
    // 4. 타임아웃
    // ============================================================

    @Test
    void run_모듈_타임아웃은_모듈만_실패시키고_스캔은_계속됨() {
        // given
        orchestrator
            .registerModule("sfp_slow", ScanPhase.DISCOVERY)
            .registerModule("sfp_next", ScanPhase.ENUMERATION);
        runner = new PhasedScanRunner(machine, orchestrator, Map.of(
            "sfp_slow", context -> {
                Thread.sleep(5_000);
                return 1;
            },
            "sfp_next", context -> 4
        ), config.withMaxModuleTimeMs(100).withMaxScanTimeMs(10_000));

        // when
        ScanState result = runner.run();

        // then
        assertThat(result).isEqualTo(ScanState.COMPLETED);
        assertThat(orchestrator.getModule("sfp_slow").orElseThrow().lastError()).contains("timed out");
        assertThat(orchestrator.getModuleStatus("sfp_next")).isEqualTo("completed");
        assertThat(orchestrator.getTotalEvents()).isEqualTo(4);
    }

    @Test
    void run_인터럽트를_무시하는_모듈은_끝날_때까지_슬롯을_점유하고_다음_모듈은_정상_실행됨() {
        // given
        AtomicBoolean fastRan = new AtomicBoolean();
        orchestrator
            .registerModule("sfp_stubborn", ScanPhase.DISCOVERY, 10)
            .registerModule("sfp_fast", ScanPhase.DISCOVERY, 1);
        runner = new PhasedScanRunner(machine, orchestrator, Map.of(
            "sfp_stubborn", context -> {
                long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(500);
                while (System.nanoTime() < deadline) {
                    try {
                        Thread.sleep(20);
                    } catch (InterruptedException ignored) {
                        // 인터럽트를 무시하고 계속 실행
                    }
                }
                return 1;
            },
            "sfp_fast", context -> {
                fastRan.set(true);
                return 7;
            }
        ), new ModuleRunnerConfig(1, 10, 200, 10_000));

        // when
        ScanState result = runner.run();

        // then
        assertThat(result).isEqualTo(ScanState.COMPLETED);
        assertThat(orchestrator.getModule("sfp_stubborn").orElseThrow().lastError()).contains("timed out");
        assertThat(fastRan).isTrue();
        assertThat(orchestrator.getModuleStatus("sfp_fast")).isEqualTo("completed");
        assertThat(orchestrator.getTotalEvents()).isEqualTo(7);
    }

    @Test
    void run_Error를_던진_모듈은_실패_처리되고_RUNNING으로_남지_않음() {
        // given
        orchestrator
            .registerModule("sfp_bad", ScanPhase.DISCOVERY)
            .registerModule("sfp_report", ScanPhase.REPORTING);
        runner = new PhasedScanRunner(machine, orchestrator, Map.of(
            "sfp_bad", context -> {
                throw new AssertionError("boom");
            },
            "sfp_report", context -> 1
        ), config);

        // when
        ScanState result = runner.run();

        // then
        assertThat(result).isEqualTo(ScanState.COMPLETED);
        assertThat(orchestrator.getModuleStatus("sfp_bad")).isEqualTo("failed");
        assertThat(orchestrator.getModule("sfp_bad").orElseThrow().lastError()).isEqualTo("boom");
        assertThat(orchestrator.getPendingModules()).isEmpty();
        assertThat(orchestrator.getTotalErrors()).isEqualTo(1);
    }

    @Test
    void run_스캔_타임아웃이면_FAILED로_종료됨() {
        // given
        orchestrator
            .registerModule("sfp_slow", ScanPhase.DISCOVERY)
            .registerModule("sfp_never", ScanPhase.REPORTING);
        runner = new PhasedScanRunner(machine, orchestrator, Map.of(
            "sfp_slow", context -> {
                Thread.sleep(5_000);
                return 1;
            },
            "sfp_never", context -> 1
        ), config.withMaxModuleTimeMs(200).withMaxScanTimeMs(200));

        // when
        ScanState result = runner.run();

        // then
        assertThat(result).isEqualTo(ScanState.FAILED);
        assertThat(orchestrator.getCurrentPhase()).isEqualTo(ScanPhase.FAILED);
        assertThat(orchestrator.getFailureReason()).hasValueSatisfying(reason -> assertThat(reason).contains("timed out"));
        assertThat(orchestrator.getModuleStatus("sfp_never")).isEqualTo("pending");
    }

    // ============================================================
    // 5. 외부 제어
    // ============================================================

    @Test
    void run_STOPPING이면_실행_중_모듈을_기다린_뒤_CANCELLED로_종료됨() throws Exception {
        // given
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        orchestrator
            .registerModule("sfp_blocking", ScanPhase.DISCOVERY)
            .registerModule("sfp_later", ScanPhase.ENUMERATION);
        runner = new PhasedScanRunner(machine, orchestrator, Map.of(
            "sfp_blocking", context -> {
                started.countDown();
                release.await();
                return 7;
            },
            "sfp_later", context -> 1
        ), config);

        // when
        Future<ScanState> result = background.submit(runner::run);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        machine.transition(ScanState.STOPPING, "User abort via API");
        release.countDown();

        // then
        assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo(ScanState.CANCELLED);
        assertThat(orchestrator.getModuleStatus("sfp_blocking")).isEqualTo("completed");
        assertThat(orchestrator.getModuleStatus("sfp_later")).isEqualTo("pending");
        assertThat(orchestrator.getFailureReason()).contains(PhasedScanRunner.STOPPED_REASON);
        assertThat(orchestrator.getTotalEvents()).isEqualTo(7);
    }

    @Test
    void run_PAUSED_동안에는_새_모듈을_디스패치하지_않음() throws Exception {
        // given
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        orchestrator
            .registerModule("sfp_first", ScanPhase.DISCOVERY, 10)
            .registerModule("sfp_second", ScanPhase.DISCOVERY, 1);
        runner = new PhasedScanRunner(machine, orchestrator, Map.of(
            "sfp_first", context -> {
                started.countDown();
                release.await();
                return 1;
            },
            "sfp_second", context -> 1
        ), config.withConcurrency(1));

        // when
        Future<ScanState> result = background.submit(runner::run);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        machine.transition(ScanState.PAUSED, "Paused by user");
        release.countDown();
        Thread.sleep(200);

        // then
        assertThat(orchestrator.getModuleStatus("sfp_first")).isEqualTo("completed");
        assertThat(orchestrator.getModuleStatus("sfp_second")).isEqualTo("pending");

        machine.transition(ScanState.RUNNING, "Resumed");
        assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo(ScanState.COMPLETED);
        assertThat(orchestrator.getModuleStatus("sfp_second")).isEqualTo("completed");
    }

    // ============================================================
    // 6. 사용 제약
    // ============================================================

    @Test
    void run_두_번_호출하면_IllegalStateException() {
        // given
        runner = new PhasedScanRunner(machine, orchestrator, Map.of(), config);
        runner.run();

        // when & then
        assertThatThrownBy(() -> runner.run())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("once");
    }

    @Test
    void run_종료된_스캔은_실행할_수_없음() {
        // given
        machine = new ScanStateMachine(SCAN_ID, ScanState.CANCELLED);
        runner = new PhasedScanRunner(machine, orchestrator, Map.of(), config);

        // when & then
        assertThatThrownBy(() -> runner.run())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("CANCELLED");
    }

    @Test
    void 생성자_다른_스캔의_머신과_오케스트레이터는_거부됨() {
        // given
        ScanStateMachine otherMachine = new ScanStateMachine(ScanId.of("scan-other"));

        // when & then
        assertThatThrownBy(() -> new PhasedScanRunner(otherMachine, orchestrator, Map.of(), config))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PhasedScanRunner(machine, orchestrator, null, config))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
