package com.ethnicthv.layers.demo;

import org.junit.platform.suite.api.SelectClasses;
import org.junit.platform.suite.api.Suite;
import org.junit.platform.suite.api.SuiteDisplayName;

/**
 * Host integration tests: label table discovery, scene filtering and the demo walkthrough.
 */
@Suite
@SuiteDisplayName("Layers Integration Test Suite")
@SelectClasses({
        ProjectLayerNamesTest.class,
        SceneQueryTest.class,
        LayerMaskDemoTest.class
})
public class LayersTestSuite {
    // Annotations define the suite
}
