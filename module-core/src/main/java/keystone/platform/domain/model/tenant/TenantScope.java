package keystone.platform.domain.model.tenant;

import java.util.regex.Pattern;
import keystone.platform.error.exception.InvalidInputException;

/**
 * 테넌트 격리 경계 (프로젝트 ID 등)
 *
 * <p>물리 키는 {@code tenant:{scope}:{key}} 형태로 파생되므로, 키 구분자({@code :})나 SCAN glob 문자가 섞이면 다른 테넌트의 키
 * 공간을 침범할 수 있습니다. 생성 시점에 허용 문자만 통과시킵니다.
 *
 * <ul>
 *   <li>공백 불가, 최대 64자
 *   <li>{@code [A-Za-z0-9_-]} 만 허용 (UUID 포함)
 * </ul>
 */
public record TenantScope(String value) {

  private static final int MAX_LENGTH = 64;
  private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_-]+");

  public TenantScope {
    if (value == null || value.isBlank()) {
      throw new InvalidInputException("tenant scope must not be blank");
    }
    if (value.length() > MAX_LENGTH) {
      throw new InvalidInputException("tenant scope exceeds " + MAX_LENGTH + " characters");
    }
    if (!ALLOWED.matcher(value).matches()) {
      throw new InvalidInputException("tenant scope contains illegal characters: " + value);
    }
  }

  public static TenantScope of(String value) {
    return new TenantScope(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
