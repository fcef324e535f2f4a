package io.github.yok.flexconfigure.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.flexconfigure.model.ArtifactType;
import io.github.yok.flexconfigure.model.DeploymentTask;
import io.github.yok.flexconfigure.remote.RemoteApiException;
import io.github.yok.flexconfigure.remote.RuntimeArtifactApi;
import io.github.yok.flexconfigure.remote.RuntimeStatus;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ArtifactDeployerTest {

    private static final DeploymentTask TASK =
            new DeploymentTask("DEV_Flow1", "DEV_Pkg1", ArtifactType.INTEGRATION, "Flow 1");

    private RuntimeArtifactApi api;
    private List<Long> sleeps;
    private Sleeper sleeper;

    @BeforeEach
    void setup() {
        api = mock(RuntimeArtifactApi.class);
        sleeps = new ArrayList<>();
        sleeper = sleeps::add;
    }

    private static RuntimeStatus status(String status) {
        return RuntimeStatus.of("1.0.0", status);
    }

    @Test
    void deploy_正常ケース_STARTINGからSTARTEDへ遷移する_3回目の確認で成功となること()
            throws Exception {
        when(api.getStatus("DEV_Flow1")).thenReturn(status("STARTING"), status("STARTING"),
                status("STARTED"));
        ArtifactDeployer deployer = new ArtifactDeployer(api, 3, 1, sleeper);

        DeploymentOutcome outcome = deployer.deploy(TASK);

        assertTrue(outcome.isSuccess());
        assertEquals(DeploymentOutcome.State.SUCCEEDED, outcome.getState());
        verify(api).deploy("DEV_Flow1", ArtifactType.INTEGRATION);
        verify(api, times(3)).getStatus("DEV_Flow1");
        assertEquals(List.of(1L, 1L, 1L), sleeps);
    }

    @Test
    void deploy_正常ケース_未デプロイ表示の後にSTARTEDとなる_成功となること() throws Exception {
        when(api.getStatus("DEV_Flow1")).thenReturn(
                RuntimeStatus.of(RuntimeStatus.NOT_DEPLOYED, ""), status("STARTED"));
        ArtifactDeployer deployer = new ArtifactDeployer(api, 5, 2, sleeper);

        assertTrue(deployer.deploy(TASK).isSuccess());
        verify(api, times(2)).getStatus("DEV_Flow1");
    }

    @Test
    void deploy_異常ケース_ERRORを受信する_エラー情報付きで失敗となること() throws Exception {
        when(api.getStatus("DEV_Flow1")).thenReturn(status("STARTING"), status("ERROR"));
        when(api.getErrorInfo("DEV_Flow1")).thenReturn("Adapter configuration invalid");
        ArtifactDeployer deployer = new ArtifactDeployer(api, 5, 1, sleeper);

        DeploymentOutcome outcome = deployer.deploy(TASK);

        assertEquals(DeploymentOutcome.State.FAILED, outcome.getState());
        assertTrue(outcome.getMessage().contains("ERROR"));
        assertTrue(outcome.getMessage().contains("Adapter configuration invalid"));
        verify(api, times(2)).getStatus("DEV_Flow1");
        assertEquals(3, sleeps.size());
    }

    @Test
    void deploy_異常ケース_エラー情報の取得に失敗する_縮退メッセージで失敗となること()
            throws Exception {
        when(api.getStatus("DEV_Flow1")).thenReturn(status("ERROR"));
        when(api.getErrorInfo("DEV_Flow1")).thenThrow(new RemoteApiException("HTTP 503"));
        ArtifactDeployer deployer = new ArtifactDeployer(api, 5, 1, sleeper);

        DeploymentOutcome outcome = deployer.deploy(TASK);

        assertEquals(DeploymentOutcome.State.FAILED, outcome.getState());
        assertTrue(outcome.getMessage().contains("ERROR"));
        assertTrue(outcome.getMessage().contains("HTTP 503"));
    }

    @Test
    void deploy_異常ケース_STARTEDにならない_リトライ上限でタイムアウトとなること() throws Exception {
        when(api.getStatus("DEV_Flow1")).thenReturn(status("STARTING"));
        ArtifactDeployer deployer = new ArtifactDeployer(api, 4, 15, sleeper);

        DeploymentOutcome outcome = deployer.deploy(TASK);

        assertFalse(outcome.isSuccess());
        assertEquals(DeploymentOutcome.State.TIMED_OUT, outcome.getState());
        assertTrue(outcome.getMessage().contains("4"));
        verify(api, times(4)).getStatus("DEV_Flow1");
        verify(api, never()).getErrorInfo(anyString());
    }

    @Test
    void deploy_正常ケース_状態取得が一時的に失敗する_次の確認で継続されること() throws Exception {
        when(api.getStatus("DEV_Flow1")).thenThrow(new RemoteApiException("timeout"))
                .thenReturn(status("STARTED"));
        ArtifactDeployer deployer = new ArtifactDeployer(api, 3, 1, sleeper);

        assertTrue(deployer.deploy(TASK).isSuccess());
        verify(api, times(2)).getStatus("DEV_Flow1");
    }

    @Test
    void deploy_異常ケース_デプロイ開始に失敗する_状態確認せず失敗となること() throws Exception {
        doThrow(new RemoteApiException("HTTP 403")).when(api).deploy("DEV_Flow1",
                ArtifactType.INTEGRATION);
        ArtifactDeployer deployer = new ArtifactDeployer(api, 3, 1, sleeper);

        DeploymentOutcome outcome = deployer.deploy(TASK);

        assertEquals(DeploymentOutcome.State.FAILED, outcome.getState());
        assertTrue(outcome.getMessage().startsWith("failed to initiate deployment"));
        verify(api, never()).getStatus(anyString());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void deploy_異常ケース_待機中に割り込まれる_失敗となり割り込みフラグが復元されること() {
        ArtifactDeployer deployer = new ArtifactDeployer(api, 3, 1, seconds -> {
            throw new InterruptedException();
        });
        try {
            DeploymentOutcome outcome = deployer.deploy(TASK);

            assertEquals(DeploymentOutcome.State.FAILED, outcome.getState());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
