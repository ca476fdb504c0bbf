// file: engine/src/main/java/io/semtree/engine/dto/JsonDiffConfig.java
package io.semtree.engine.dto;

/**
 * Raw JSON shape of a diff configuration file. Boxed fields so that a missing
 * key stays null and falls back to the default.
 */
public class JsonDiffConfig {
    public Double similarityThreshold;
    public Boolean hashMatching;
    public Boolean similarityMatching;
    public Boolean propagation;
    public String attributeOrder;
    public Integer maxNodeCount;
}
