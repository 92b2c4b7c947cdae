package com.overseer.supervisors;

import com.overseer.models.Rule;
import com.overseer.models.Severity;
import com.overseer.models.SupervisorConfig;
import com.overseer.models.SupervisorKind;

import java.util.List;

/**
 * Built-in hierarchy installed when no supervisor file is configured.
 */
public final class DefaultHierarchy {

    public static final String TECHNICAL_ID = "default-technical";
    public static final String BUSINESS_ID = "default-business";
    public static final String BEHAVIOR_ID = "default-behavior";
    public static final String SECURITY_ID = "default-security";
    public static final String ARCHITECTURE_ID = "default-architecture";
    public static final String COMPLETENESS_ID = "default-completeness";

    private DefaultHierarchy() {
    }

    public static List<SupervisorConfig> configs() {
        SupervisorConfig technical = new SupervisorConfig(TECHNICAL_ID, "Technical", SupervisorKind.COORDINATOR)
            .keywords("code", "codigo", "function", "funcao", "class", "classe", "method", "metodo",
                "variable", "variavel", "import", "export");

        SupervisorConfig business = new SupervisorConfig(BUSINESS_ID, "Business", SupervisorKind.COORDINATOR)
            .keywords("rule", "regra", "validation", "validacao", "process", "processo", "flow", "fluxo",
                "user", "usuario");

        SupervisorConfig behavior = new SupervisorConfig(BEHAVIOR_ID, "Behavior", SupervisorKind.COORDINATOR)
            .keywords("implement", "implementar", "create", "criar", "only", "apenas", "later", "depois");

        SupervisorConfig security = new SupervisorConfig(SECURITY_ID, "Security", SupervisorKind.SPECIALIST)
            .parent(TECHNICAL_ID)
            .keywords("sql", "query", "password", "senha", "token", "auth", "input", "html", "xss")
            .rule(new Rule("sql-injection", "SQL built from untrusted input", Severity.CRITICAL,
                "Check whether the text builds an SQL query by concatenating or interpolating user input "
                    + "instead of using parameters or prepared statements."))
            .rule(new Rule("xss-prevention", "Unescaped output in HTML", Severity.HIGH,
                "Check whether the text writes user-controlled data into HTML without escaping or sanitizing it."));

        SupervisorConfig architecture = new SupervisorConfig(ARCHITECTURE_ID, "Architecture", SupervisorKind.SPECIALIST)
            .parent(TECHNICAL_ID)
            .keywords("module", "modulo", "layer", "camada", "dependency", "dependencia", "service", "servico");

        SupervisorConfig completeness = new SupervisorConfig(COMPLETENESS_ID, "Completeness", SupervisorKind.SPECIALIST)
            .parent(BEHAVIOR_ID)
            .keywords("only", "apenas", "por enquanto", "first", "primeiro", "later", "depois")
            .rule(new Rule("scope-reduction", "Scope reduced without approval", Severity.HIGH,
                "Check whether the text plans to implement only part of what was requested, "
                    + "leaving the rest for later without the user asking for it."));

        return List.of(technical, business, behavior, security, architecture, completeness);
    }

    /**
     * Install the built-in supervisors into the tree.
     *
     * @return configuration problems, empty on success
     */
    public static List<String> install(SupervisorTree tree) {
        return tree.addAll(configs());
    }
}
