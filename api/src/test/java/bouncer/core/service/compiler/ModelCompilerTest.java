package bouncer.core.service.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import bouncer.core.model.ModelCompileException;
import bouncer.core.model.definition.MatchingOptions;
import bouncer.core.model.definition.PatternMode;
import bouncer.core.model.definition.PolicyEffect;
import bouncer.core.service.TestModels;
import bouncer.core.service.function.FunctionRegistry;

@DisplayName("ModelCompiler")
class ModelCompilerTest {

    private final ModelCompiler compiler = new ModelCompiler();

    @Nested
    @DisplayName("valid models")
    class ValidModelTests {

        @Test
        @DisplayName("should compile the basic ACL model")
        void shouldCompileAcl() {
            final var model = compiler.compile(TestModels.ACL);

            assertEquals(List.of("sub", "obj", "act"), model.request().fields());
            assertEquals(3, model.policy().arity());
            assertTrue(model.roles().isEmpty());
            assertEquals(PolicyEffect.ALLOW_OVERRIDE, model.effect());
            assertTrue(model.matcher().referencesPolicy());
        }

        @Test
        @DisplayName("should register role definitions as sections and functions")
        void shouldCompileRoles() {
            final var model = compiler.compile(TestModels.RBAC_WITH_DOMAINS);

            assertTrue(model.acceptsSection("g"));
            assertTrue(model.role("g").orElseThrow().hasDomain());
            assertEquals(3, model.arityOf("g"));
            assertEquals(4, model.arityOf("p"));
            assertFalse(model.acceptsSection("g2"));
        }

        @Test
        @DisplayName("should recognise every supported effect")
        void shouldResolveEffects() {
            assertEquals(PolicyEffect.DENY_OVERRIDE, compiler.compile(TestModels.RBAC_DENY_OVERRIDE).effect());
            assertEquals(PolicyEffect.PRIORITY, compiler.compile(TestModels.PRIORITY).effect());
            assertEquals(PolicyEffect.ALLOW_BY_DEFAULT, compiler.compile(TestModels.ALLOW_BY_DEFAULT).effect());
        }

        @Test
        @DisplayName("should locate the eft and priority fields")
        void shouldIndexSpecialFields() {
            final var model = compiler.compile(TestModels.PRIORITY);

            assertEquals(0, model.priorityIndex().getAsInt());
            assertEquals(4, model.effectIndex().getAsInt());
        }

        @Test
        @DisplayName("should ignore comments and join continued lines")
        void shouldHandleCommentsAndContinuations() {
            final var model = compiler.compile("""
                    # leading comment
                    [request_definition]
                    r = sub, obj, act

                    [policy_definition]
                    p = sub, obj, act

                    [policy_effect]
                    e = some(where (p.eft == allow))

                    [matchers]
                    # the matcher spans two lines
                    m = r.sub == p.sub && r.obj == p.obj \\
                        && r.act == p.act
                    """);

            assertTrue(model.matcherText().endsWith("r.act == p.act"));
        }

        @Test
        @DisplayName("should expose custom functions to matchers")
        void shouldUseCustomFunctions() {
            final var custom = new ModelCompiler(
                    MatchingOptions.defaults(), FunctionRegistry.empty().with("isOwner", 2, (args, ctx) -> true));

            final var model = custom.compile(TestModels.ACL.replace(
                    "m = r.sub == p.sub", "m = isOwner(r.sub, p.sub)"));

            assertTrue(model.matcherText().startsWith("isOwner"));
        }

        @Test
        @DisplayName("should compile eval rules lazily and cache them")
        void shouldCompileRules() {
            final var model = compiler.compile(TestModels.ABAC_RULE);

            final var first = model.ruleCompiler().compile("r.sub == 'alice'");
            assertEquals(first, model.ruleCompiler().compile("r.sub == 'alice'"));
        }
    }

    @Nested
    @DisplayName("invalid models")
    class InvalidModelTests {

        @Test
        @DisplayName("should reject empty text")
        void shouldRejectEmpty() {
            assertThrows(ModelCompileException.class, () -> compiler.compile(""));
        }

        @Test
        @DisplayName("should reject a missing matchers section")
        void shouldRejectMissingSection() {
            final var text = TestModels.ACL.substring(0, TestModels.ACL.indexOf("[matchers]"));

            final var e = assertThrows(ModelCompileException.class, () -> compiler.compile(text));

            assertEquals("matchers", e.section());
        }

        @Test
        @DisplayName("should reject unknown sections")
        void shouldRejectUnknownSection() {
            assertThrows(ModelCompileException.class, () -> compiler.compile(TestModels.ACL + "\n[extras]\nx = 1\n"));
        }

        @Test
        @DisplayName("should reject duplicate sections")
        void shouldRejectDuplicateSection() {
            assertThrows(ModelCompileException.class,
                    () -> compiler.compile(TestModels.ACL + "\n[matchers]\nm = true\n"));
        }

        @Test
        @DisplayName("should reject duplicate field names")
        void shouldRejectDuplicateField() {
            assertThrows(ModelCompileException.class,
                    () -> compiler.compile(TestModels.ACL.replace("r = sub, obj, act", "r = sub, sub, act")));
        }

        @Test
        @DisplayName("should reject role definitions with the wrong shape")
        void shouldRejectBadRoleDefinition() {
            assertThrows(ModelCompileException.class,
                    () -> compiler.compile(TestModels.RBAC.replace("g = _, _", "g = _")));
            assertThrows(ModelCompileException.class,
                    () -> compiler.compile(TestModels.RBAC.replace("g = _, _", "g = _, x")));
        }

        @Test
        @DisplayName("should reject unsupported effects")
        void shouldRejectUnsupportedEffect() {
            final var e = assertThrows(ModelCompileException.class, () -> compiler.compile(
                    TestModels.ACL.replace("some(where (p.eft == allow))", "max(p.eft)")));

            assertEquals("policy_effect", e.section());
        }

        @Test
        @DisplayName("should reject matchers referencing undeclared fields")
        void shouldRejectUndeclaredField() {
            assertThrows(ModelCompileException.class,
                    () -> compiler.compile(TestModels.ACL.replace("r.act == p.act", "r.act == p.action")));
        }

        @Test
        @DisplayName("should reject role functions that were not declared")
        void shouldRejectUndeclaredRoleFunction() {
            assertThrows(ModelCompileException.class,
                    () -> compiler.compile(TestModels.RBAC.replace("g(r.sub, p.sub)", "g2(r.sub, p.sub)")));
        }

        @Test
        @DisplayName("should leave regexMatch out in wildcard mode")
        void shouldOmitRegexInWildcardMode() {
            final var wildcard = new ModelCompiler(
                    MatchingOptions.defaults().withPatternMode(PatternMode.WILDCARD), FunctionRegistry.empty());

            assertThrows(ModelCompileException.class, () -> wildcard.compile(TestModels.KEY_MATCH));
        }
    }
}
