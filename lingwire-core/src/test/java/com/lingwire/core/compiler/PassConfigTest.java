package com.lingwire.core.compiler;

import com.lingwire.api.exception.InvalidArgumentException;
import com.lingwire.core.container.ContainerBuilder;
import com.lingwire.core.container.ContainerConfig;
import com.lingwire.core.spi.CompilerPass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PassConfig 单元测试")
public class PassConfigTest {

    @Mock
    private CompilerPass optimize;

    @Mock
    private CompilerPass removeLow;

    @Mock
    private CompilerPass removeHigh;

    @Mock
    private CompilerPass beforeFirst;

    @Mock
    private CompilerPass beforeSecond;

    @Test
    @DisplayName("按阶段、优先级降序、注册顺序排序")
    void passesShouldBeOrdered() {
        PassConfig config = new PassConfig();
        config.addPass(removeLow, PassStage.REMOVE, 0);
        config.addPass(optimize, PassStage.OPTIMIZE, 0);
        config.addPass(removeHigh, PassStage.REMOVE, 10);
        config.addPass(beforeFirst, PassStage.BEFORE_OPTIMIZATION, 0);
        config.addPass(beforeSecond, null, 0);

        assertEquals(List.of(beforeFirst, beforeSecond, optimize, removeHigh, removeLow), config.getPasses());
        assertEquals(5, config.size());
    }

    @Test
    @DisplayName("null Pass 被拒绝")
    void nullPassShouldBeRejected() {
        PassConfig config = new PassConfig();

        assertThrows(InvalidArgumentException.class, () -> config.addPass(null, PassStage.OPTIMIZE, 0));
    }

    @Test
    @DisplayName("compile 按顺序执行 Pass")
    void compileShouldRunPassesInOrder() {
        ContainerBuilder builder = new ContainerBuilder(ContainerConfig.builder().registerDefaultPasses(false).build());
        builder.addCompilerPass(removeLow, PassStage.AFTER_REMOVING);
        builder.addCompilerPass(optimize, PassStage.BEFORE_REMOVING, 5);
        builder.addCompilerPass(removeHigh, PassStage.BEFORE_REMOVING, 50);
        builder.addCompilerPass(beforeFirst);

        builder.compile();

        InOrder inOrder = inOrder(beforeFirst, removeHigh, optimize, removeLow);
        inOrder.verify(beforeFirst).process(builder);
        inOrder.verify(removeHigh).process(builder);
        inOrder.verify(optimize).process(builder);
        inOrder.verify(removeLow).process(builder);
        verifyNoInteractions(beforeSecond);
    }

    @Test
    @DisplayName("默认 Pass 流水线")
    void defaultPipeline() {
        ContainerBuilder builder = new ContainerBuilder();

        List<PassConfig.Entry> entries = builder.getPassConfig().getOrderedEntries();

        assertEquals(3, entries.size());
        assertInstanceOf(ResolveChildDefinitionsPass.class, entries.get(0).pass());
        assertInstanceOf(AutowirePass.class, entries.get(1).pass());
        assertInstanceOf(ResolveReferencesPass.class, entries.get(2).pass());
        assertEquals(PassStage.BEFORE_REMOVING, entries.get(2).stage());
    }
}
