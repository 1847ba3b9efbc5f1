/**
 * 워크로드 매니저 연동 facade와 응답 view.
 *
 * @since 1.0.0
 */
package com.ryuqq.provisioner.application.facade;
