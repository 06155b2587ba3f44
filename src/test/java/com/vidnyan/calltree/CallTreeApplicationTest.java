package com.vidnyan.calltree;

import com.vidnyan.calltree.adapter.out.parser.RteClassifier;
import com.vidnyan.calltree.application.port.in.AnalyzeCallTreeUseCase;
import com.vidnyan.calltree.config.CallTreeProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "calltree.rte-prefix=Ioc_",
        "calltree.max-depth=5"
})
class CallTreeApplicationTest {

    @Autowired
    private CallTreeProperties properties;

    @Autowired
    private RteClassifier rteClassifier;

    @Autowired
    private AnalyzeCallTreeUseCase analyzeCallTreeUseCase;

    @Test
    void contextLoads_ShouldBindCallTreeProperties() {
        assertEquals(5, properties.getMaxDepth());
        assertEquals(List.of(".c"), properties.getExtensions());
        assertTrue(properties.isIncludeRte());
        assertTrue(properties.getSourcePath().isEmpty());
        assertEquals("Ioc_", rteClassifier.prefix());
        assertNotNull(analyzeCallTreeUseCase);
    }
}
