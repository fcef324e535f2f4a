package io.github.yok.flexconfigure.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import io.github.yok.flexconfigure.model.ArtifactType;
import io.github.yok.flexconfigure.model.BatchSettings;
import io.github.yok.flexconfigure.model.ConfigurationParameter;
import io.github.yok.flexconfigure.model.ConfigureArtifact;
import io.github.yok.flexconfigure.model.ConfigureConfig;
import io.github.yok.flexconfigure.model.ConfigurePackage;
import io.github.yok.flexconfigure.model.DeploymentTask;
import io.github.yok.flexconfigure.model.RunStats;
import io.github.yok.flexconfigure.remote.BatchExecutor;
import io.github.yok.flexconfigure.remote.DesigntimeConfigurationApi;
import io.github.yok.flexconfigure.remote.RemoteApiException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ArtifactConfiguratorTest {

    private static final BatchSettings NO_BATCH = new BatchSettings(false, 90);

    private DesigntimeConfigurationApi api;
    private BatchExecutor batchExecutor;
    private RunStats stats;

    @BeforeEach
    void setup() {
        api = mock(DesigntimeConfigurationApi.class);
        batchExecutor = mock(BatchExecutor.class);
        stats = new RunStats();
    }

    private static ConfigureArtifact artifact(String id, boolean deploy, BatchSettings batch,
            int parameterCount) {
        List<ConfigurationParameter> params = new ArrayList<>();
        for (int i = 1; i <= parameterCount; i++) {
            params.add(new ConfigurationParameter("key" + i, "value" + i));
        }
        return ConfigureArtifact.builder().id(id).type(ArtifactType.INTEGRATION)
                .version("active").deploy(deploy).parameters(params).batch(batch).build();
    }

    private static ConfigurePackage pkg(String id, boolean deploy, ConfigureArtifact... artifacts) {
        return ConfigurePackage.builder().id(id).deploy(deploy).artifacts(List.of(artifacts))
                .build();
    }

    private ArtifactConfigurator configurator(ArtifactFilter filter, boolean dryRun) {
        return new ArtifactConfigurator(new ParameterUpdater(api, batchExecutor, 90, false),
                filter, dryRun);
    }

    @Test
    void configureAll_正常ケース_バッチ無効で2パラメータを指定する_個別更新2回でタスクなしとなること()
            throws Exception {
        ConfigureConfig config = new ConfigureConfig("",
                List.of(pkg("Pkg1", false, artifact("A1", false, NO_BATCH, 2))));

        List<DeploymentTask> tasks = configurator(ArtifactFilter.none(), false)
                .configureAll(config, stats);

        assertTrue(tasks.isEmpty());
        verify(api).updateParameter("A1", "active", "key1", "value1");
        verify(api).updateParameter("A1", "active", "key2", "value2");
        assertEquals(1, stats.getArtifactsConfigured());
        assertEquals(2, stats.getIndividualRequestsUsed());
        assertEquals(0, stats.getDeploymentTasksQueued());
    }

    @Test
    void configureAll_正常ケース_パッケージのみdeploy指定_タスクが1件登録されること()
            throws Exception {
        ConfigureConfig config = new ConfigureConfig("",
                List.of(pkg("Pkg1", true, artifact("A1", false, NO_BATCH, 3))));

        List<DeploymentTask> tasks = configurator(ArtifactFilter.none(), false)
                .configureAll(config, stats);

        assertEquals(1, tasks.size());
        assertEquals("A1", tasks.get(0).getArtifactId());
        assertEquals("Pkg1", tasks.get(0).getPackageId());
        assertEquals(3, stats.getParametersUpdated());
        assertEquals(1, stats.getDeploymentTasksQueued());
    }

    @Test
    void configureAll_正常ケース_プレフィックスを指定する_リモート呼び出しにプレフィックス付きIDが使われること()
            throws Exception {
        ConfigureConfig config = new ConfigureConfig("DEV_",
                List.of(pkg("Pkg1", false, artifact("Flow1", true, NO_BATCH, 1))));

        List<DeploymentTask> tasks = configurator(ArtifactFilter.none(), false)
                .configureAll(config, stats);

        verify(api).updateParameter("DEV_Flow1", "active", "key1", "value1");
        assertEquals("DEV_Flow1", tasks.get(0).getArtifactId());
        assertEquals("DEV_Pkg1", tasks.get(0).getPackageId());
    }

    @Test
    void configureAll_正常ケース_ドライランを指定する_リモート呼び出しなしで同じカウンタとなること()
            throws Exception {
        ConfigureConfig config = new ConfigureConfig("", List.of(
                pkg("Pkg1", true, artifact("A1", false, null, 2), artifact("A2", false, null, 3)),
                pkg("Pkg2", false, artifact("B1", false, null, 1))));

        RunStats dry = new RunStats();
        List<DeploymentTask> dryTasks =
                configurator(ArtifactFilter.none(), true).configureAll(config, dry);

        assertTrue(dryTasks.isEmpty());
        verifyNoInteractions(api, batchExecutor);

        DesigntimeConfigurationApi liveApi = mock(DesigntimeConfigurationApi.class);
        List<DeploymentTask> liveTasks = new ArtifactConfigurator(
                new ParameterUpdater(liveApi, batchExecutor, 90, true), ArtifactFilter.none(),
                false).configureAll(config, stats);

        assertEquals(stats.getPackagesProcessed(), dry.getPackagesProcessed());
        assertEquals(stats.getArtifactsProcessed(), dry.getArtifactsProcessed());
        assertEquals(stats.getArtifactsConfigured(), dry.getArtifactsConfigured());
        assertEquals(stats.getParametersUpdated(), dry.getParametersUpdated());
        assertEquals(stats.getDeploymentTasksQueued(), dry.getDeploymentTasksQueued());
        assertEquals(2, liveTasks.size());
        assertEquals(6, dry.getParametersUpdated());
        assertEquals(2, dry.getDeploymentTasksQueued());
    }

    @Test
    void configureAll_正常ケース_パッケージフィルタを指定する_除外分はカウントされないこと() {
        ConfigureConfig config = new ConfigureConfig("", List.of(
                pkg("Pkg1", false, artifact("A1", false, null, 0)),
                pkg("Pkg2", false, artifact("B1", false, null, 0),
                        artifact("B2", false, null, 0))));

        configurator(ArtifactFilter.parse("Pkg1", ""), false).configureAll(config, stats);

        assertEquals(1, stats.getPackagesProcessed());
        assertEquals(1, stats.getArtifactsProcessed());
        assertEquals(1, stats.getArtifactsConfigured());
    }

    @Test
    void configureAll_正常ケース_アーティファクトフィルタを指定する_対象のみ処理されること()
            throws Exception {
        ConfigureConfig config = new ConfigureConfig("", List.of(pkg("Pkg1", false,
                artifact("A1", false, NO_BATCH, 1),
                artifact("A2", false, NO_BATCH, 1))));

        configurator(ArtifactFilter.parse("", "A2"), false).configureAll(config, stats);

        verify(api, never()).updateParameter(eq("A1"), anyString(), anyString(), anyString());
        verify(api).updateParameter("A2", "active", "key1", "value1");
        assertEquals(1, stats.getArtifactsProcessed());
    }

    @Test
    void configureAll_異常ケース_1件の取得に失敗する_失敗を計上し残りを処理すること() throws Exception {
        when(api.getParameters(eq("A1"), any()))
                .thenThrow(new RemoteApiException("HTTP 500"));
        ConfigureConfig config = new ConfigureConfig("", List.of(pkg("Pkg1", true,
                artifact("A1", false, null, 1),
                artifact("A2", false, NO_BATCH, 1))));

        List<DeploymentTask> tasks = configurator(ArtifactFilter.none(), false)
                .configureAll(config, stats);

        assertEquals(1, tasks.size());
        assertEquals("A2", tasks.get(0).getArtifactId());
        assertEquals(1, stats.getArtifactsFailed());
        assertEquals(1, stats.getArtifactsConfigured());
        assertEquals(1, stats.getPackagesWithErrors());
        assertTrue(stats.hasFailures());
    }
}
