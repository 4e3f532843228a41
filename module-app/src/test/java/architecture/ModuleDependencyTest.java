package architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.domain.JavaModifier;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * 모듈 의존 방향 검증
 *
 * <pre>
 * module-app      (scheduler, lifecycle, config)
 *     ↓
 * module-infra    (infrastructure.*: Redisson, Resilience4j, Spring 조립)
 *     ↓
 * module-core     (domain.*, core.port.*)
 *     ↓
 * module-common   (error.*, common.*)
 * </pre>
 */
@DisplayName("Module Dependency Enforcement")
class ModuleDependencyTest {

  private final JavaClasses classes =
      new ClassFileImporter()
          .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
          .importPackages("keystone.platform");

  @Nested
  @DisplayName("Dependency Direction: app → infra → core → common")
  class DependencyDirectionTests {

    @Test
    @DisplayName("module-common must not depend on other modules")
    void commonIsFoundation() {
      noClasses()
          .that()
          .resideInAnyPackage("keystone.platform.common..", "keystone.platform.error..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "keystone.platform.domain..",
              "keystone.platform.core..",
              "keystone.platform.infrastructure..")
          .check(classes);
    }

    @Test
    @DisplayName("module-core must not depend on infrastructure or frameworks")
    void coreIsFrameworkFree() {
      noClasses()
          .that()
          .resideInAnyPackage("keystone.platform.domain..", "keystone.platform.core..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "keystone.platform.infrastructure..",
              "org.springframework..",
              "org.redisson..",
              "io.github.resilience4j..")
          .because("core holds the domain model and ports only")
          .check(classes);
    }

    @Test
    @DisplayName("module-infra must not depend on application wiring")
    void infraDoesNotReachUp() {
      noClasses()
          .that()
          .resideInAPackage("keystone.platform.infrastructure..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "keystone.platform.scheduler..",
              "keystone.platform.lifecycle..",
              "keystone.platform.config..")
          .check(classes);
    }
  }

  @Nested
  @DisplayName("Third-party containment")
  class ContainmentTests {

    @Test
    @DisplayName("Redisson is used only by the key store adapter and its configuration")
    void redissonIsContained() {
      noClasses()
          .that()
          .resideOutsideOfPackages(
              "keystone.platform.infrastructure.keystore..",
              "keystone.platform.infrastructure.config..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("org.redisson..")
          .check(classes);
    }

    @Test
    @DisplayName("Resilience4j is used only by the resilience package and its configuration")
    void resilience4jIsContained() {
      noClasses()
          .that()
          .resideOutsideOfPackages(
              "keystone.platform.infrastructure.resilience..",
              "keystone.platform.infrastructure.config..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("io.github.resilience4j..")
          .check(classes);
    }

    @Test
    @DisplayName("domain components reach the store through the tenant accessor")
    void domainComponentsUseAccessor() {
      noClasses()
          .that()
          .resideInAnyPackage(
              "keystone.platform.infrastructure.cache..",
              "keystone.platform.infrastructure.ratelimit..",
              "keystone.platform.infrastructure.queue..")
          .should()
          .dependOnClassesThat()
          .haveSimpleName("RedissonKeyStoreClient")
          .orShould()
          .dependOnClassesThat()
          .haveSimpleName("InMemoryKeyStoreClient")
          .orShould()
          .dependOnClassesThat()
          .haveSimpleName("GuardedKeyStore")
          .because("tenant prefixing and breaker protection are applied below the accessor")
          .check(classes);
    }
  }

  @Nested
  @DisplayName("Script catalogs")
  class ScriptTests {

    @Test
    @DisplayName("*Scripts classes are final utility holders")
    void scriptsAreFinal() {
      classes()
          .that()
          .haveSimpleNameEndingWith("Scripts")
          .should()
          .haveModifier(JavaModifier.FINAL)
          .check(classes);
    }
  }
}
