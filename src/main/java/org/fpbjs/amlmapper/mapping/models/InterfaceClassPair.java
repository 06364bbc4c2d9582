package org.fpbjs.amlmapper.mapping.models;

/**
 * InterfaceClass paths used for the two ends of a flow.
 *
 * @param out path of the interface placed on the source element
 * @param in  path of the interface placed on the target element
 */
public record InterfaceClassPair(String out, String in) {

    public String outBaseName() {
        return baseName(out);
    }

    public String inBaseName() {
        return baseName(in);
    }

    private static String baseName(String classPath) {
        return classPath.substring(classPath.indexOf('/') + 1);
    }
}
