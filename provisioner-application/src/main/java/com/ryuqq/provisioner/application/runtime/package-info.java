/**
 * Runtime 인터페이스.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.application.runtime.Runtime} - 진행 중인 Request를 주기적으로 dispatch/reconcile</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code ReconcileRuntime}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.provisioner.application.runtime;
