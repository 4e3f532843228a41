package keystone.platform.domain.model.cache;

import java.util.Collection;
import keystone.platform.error.exception.InvalidInputException;

/** 캐시 논리 키와 태그 형식 검증. */
public final class CacheKeys {

  public static final int MAX_KEY_LENGTH = 250;
  public static final int MAX_TAG_LENGTH = 50;
  public static final int MAX_TAGS = 20;

  /** 엔트리 hash의 tags 필드 구분자 */
  public static final char TAG_SEPARATOR = ',';

  private CacheKeys() {}

  public static String requireValidKey(String key) {
    if (key == null || key.isEmpty()) {
      throw new InvalidInputException("cache key must not be empty");
    }
    if (key.length() > MAX_KEY_LENGTH) {
      throw new InvalidInputException("cache key exceeds " + MAX_KEY_LENGTH + " characters");
    }
    if (containsWhitespace(key)) {
      throw new InvalidInputException("cache key must not contain whitespace: " + key);
    }
    return key;
  }

  public static String requireValidTag(String tag) {
    if (tag == null || tag.isEmpty()) {
      throw new InvalidInputException("cache tag must not be empty");
    }
    if (tag.length() > MAX_TAG_LENGTH) {
      throw new InvalidInputException("cache tag exceeds " + MAX_TAG_LENGTH + " characters");
    }
    if (containsWhitespace(tag) || tag.indexOf(TAG_SEPARATOR) >= 0) {
      throw new InvalidInputException("cache tag must not contain whitespace or ',': " + tag);
    }
    return tag;
  }

  public static void requireValidTags(Collection<String> tags) {
    if (tags.size() > MAX_TAGS) {
      throw new InvalidInputException("at most " + MAX_TAGS + " tags per entry");
    }
    tags.forEach(CacheKeys::requireValidTag);
  }

  private static boolean containsWhitespace(String value) {
    return value.chars().anyMatch(Character::isWhitespace);
  }
}
