package io.mersel.services.creative.infrastructure.support;

import java.util.regex.Pattern;

/**
 * Ad-server makro sözdizimi yardımcıları.
 * <p>
 * Sunucu, teslimat anında {@code %%FILE:ID%%} makrolarını asset'in gerçek URL'i ile
 * değiştirir. Aynı motor {@code %} ve ardından gelen tek harfli kodları da makro
 * olarak yorumlar; script içindeki mod operatörü bu nedenle kaçışlanır.
 */
public final class Macros {

    /** Varsayılan makro şablonu; {@code {id}} asset kimliği ile değiştirilir. */
    public static final String FILE_TEMPLATE = "%%FILE:{id}%%";

    private static final String ID_PLACEHOLDER = "{id}";

    /**
     * Başında başka bir {@code %} olmayan ve ardından makro harf kodlarından biri gelen {@code %}.
     */
    private static final Pattern MODULO_OPERATOR = Pattern.compile("(?<!%)%(?=[acghinstu])");

    private Macros() {
    }

    /**
     * Asset kimliği için {@code %%FILE:ID%%} makrosu.
     */
    public static String fileMacro(String id) {
        return render(FILE_TEMPLATE, id);
    }

    /**
     * Şablondaki {@code {id}} yer tutucusunu kimlikle değiştirir.
     */
    public static String render(String template, String id) {
        return (template != null ? template : FILE_TEMPLATE).replace(ID_PLACEHOLDER, id);
    }

    /**
     * Mod operatörü ile harf arasına boşluk ekler: {@code a%i} → {@code a% i}.
     * İki kez uygulanması tek seferle aynı sonucu verir.
     */
    public static String escapeModuloOperator(String script) {
        if (script == null || script.indexOf('%') < 0) {
            return script;
        }
        return MODULO_OPERATOR.matcher(script).replaceAll("% ");
    }
}
