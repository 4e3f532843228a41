package keystone.platform.error.exception.marker;

/** 서킷 브레이커 실패 집계에서 제외되는 예외 (검증, 스코프, 용량, 스크립트 오류 등). */
public interface CircuitBreakerIgnoreMarker {}
