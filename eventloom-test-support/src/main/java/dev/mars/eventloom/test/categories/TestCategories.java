package dev.mars.eventloom.test.categories;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Test category constants used with JUnit 5 {@code @Tag} annotations.
 *
 * <h3>Test Categories:</h3>
 * <ul>
 *   <li><strong>CORE</strong> - Fast unit tests with in-memory collaborators only</li>
 *   <li><strong>INTEGRATION</strong> - Tests wiring several modules together end to end</li>
 *   <li><strong>CONCURRENCY</strong> - Multi-threaded tests exercising per-aggregate serialization</li>
 * </ul>
 *
 * <pre>{@code
 * mvn test                  # everything
 * mvn test -Pcore-tests     # core only
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 * @see org.junit.jupiter.api.Tag
 */
public final class TestCategories {

    /**
     * Core tests - fast, single-threaded, no external infrastructure.
     */
    public static final String CORE = "core";

    /**
     * Integration tests - several modules wired together.
     */
    public static final String INTEGRATION = "integration";

    /**
     * Concurrency tests - several threads racing on the same or different aggregates.
     */
    public static final String CONCURRENCY = "concurrency";

    private TestCategories() {
        // Utility class - prevent instantiation
    }
}
