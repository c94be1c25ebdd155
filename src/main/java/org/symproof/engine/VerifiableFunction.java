package org.symproof.engine;

import lombok.Getter;
import org.symproof.contract.TypeAnnotation;
import org.symproof.lang.parser.SourceText;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 待验证的函数：源码文本，以及它引用的闭包值、模块级值和类型别名。
 * 外部名字先在闭包中查找，再查模块级值。
 * 拿不到源码的函数用 {@link #opaque(String, String)} 表示，验证时直接 SKIPPED。
 */
@Getter
public final class VerifiableFunction {

    private static final Pattern DEF_NAME = Pattern.compile("def\\s+(\\w+)");

    private final String name;
    private final String source;
    private final String unavailableReason;
    private final Map<String, Object> closureValues;
    private final Map<String, Object> moduleValues;
    private final Map<String, TypeAnnotation> typeAliases;

    private VerifiableFunction(String name, String source, String unavailableReason,
                               Map<String, Object> closureValues, Map<String, Object> moduleValues,
                               Map<String, TypeAnnotation> typeAliases) {
        this.name = name;
        this.source = source;
        this.unavailableReason = unavailableReason;
        this.closureValues = Collections.unmodifiableMap(closureValues);
        this.moduleValues = Collections.unmodifiableMap(moduleValues);
        this.typeAliases = Collections.unmodifiableMap(typeAliases);
    }

    /**
     * 由源码构造，源码会被规范化（统一换行、去掉公共缩进）。
     */
    public static VerifiableFunction fromSource(String source) {
        Objects.requireNonNull(source, "Source cannot be null");
        String canonical = SourceText.canonicalize(source);
        return new VerifiableFunction(displayName(canonical), canonical, null,
                new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    /**
     * 无法获得源码的函数。
     */
    public static VerifiableFunction opaque(String name, String reason) {
        Objects.requireNonNull(name, "Function name cannot be null");
        return new VerifiableFunction(name, null, reason == null ? "source not available" : reason,
                new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    private static String displayName(String source) {
        Matcher m = DEF_NAME.matcher(source);
        return m.find() ? m.group(1) : "<unknown>";
    }

    public boolean hasSource() {
        return source != null;
    }

    public VerifiableFunction withClosure(String name, Object value) {
        Map<String, Object> closure = new LinkedHashMap<>(closureValues);
        closure.put(Objects.requireNonNull(name, "Name cannot be null"), value);
        return new VerifiableFunction(this.name, source, unavailableReason, closure,
                new LinkedHashMap<>(moduleValues), new LinkedHashMap<>(typeAliases));
    }

    public VerifiableFunction withGlobal(String name, Object value) {
        Map<String, Object> module = new LinkedHashMap<>(moduleValues);
        module.put(Objects.requireNonNull(name, "Name cannot be null"), value);
        return new VerifiableFunction(this.name, source, unavailableReason,
                new LinkedHashMap<>(closureValues), module, new LinkedHashMap<>(typeAliases));
    }

    public VerifiableFunction withTypeAlias(String alias, TypeAnnotation type) {
        Map<String, TypeAnnotation> aliases = new LinkedHashMap<>(typeAliases);
        aliases.put(Objects.requireNonNull(alias, "Alias cannot be null"),
                Objects.requireNonNull(type, "Type cannot be null"));
        return new VerifiableFunction(name, source, unavailableReason,
                new LinkedHashMap<>(closureValues), new LinkedHashMap<>(moduleValues), aliases);
    }

    /**
     * 外部名字的值：闭包优先于模块级。
     */
    public Optional<Object> lookupExternal(String name) {
        if (closureValues.containsKey(name)) {
            return Optional.ofNullable(closureValues.get(name));
        }
        return Optional.ofNullable(moduleValues.get(name));
    }

    @Override
    public String toString() {
        return hasSource() ? name : name + " (opaque)";
    }
}
