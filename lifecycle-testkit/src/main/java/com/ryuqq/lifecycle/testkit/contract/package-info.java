/**
 * Contract tests every FeatureStore adapter must pass.
 *
 * <p>Extend {@link com.ryuqq.lifecycle.testkit.contract.AbstractFeatureStoreContractTest} and implement
 * {@code createStore()}:</p>
 * <pre>
 * class MyFeatureStoreContractTest extends AbstractFeatureStoreContractTest {
 *     {@literal @}Override
 *     protected FeatureStore createStore() {
 *         return new MyFeatureStore();
 *     }
 * }
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.testkit.contract;
