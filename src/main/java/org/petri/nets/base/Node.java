package org.petri.nets.base;

import lombok.Getter;
import org.petri.exceptions.StructureException;
import org.petri.expressions.arcs.ArcAnnotation;
import org.petri.nets.models.PetriNet;

import java.util.Map;
import java.util.Objects;

/**
 * 网中的节点：库所或变迁。
 * 节点按对象身份比较，名字只在所属的网中唯一。
 * @author Ayalyt
 */
public abstract class Node {

    @Getter
    private String name;
    @Getter
    private PetriNet net;

    protected Node(String name) {
        this.name = Objects.requireNonNull(name, "Node name cannot be null");
    }

    /**
     * @return 前驱节点名到弧标注的只读映射。
     */
    public abstract Map<String, ArcAnnotation> getPre();

    /**
     * @return 后继节点名到弧标注的只读映射。
     */
    public abstract Map<String, ArcAnnotation> getPost();

    /**
     * 改名。属于某个网的节点只能通过 {@link PetriNet#renameNode} 改名，网会先以新名字登记该节点。
     * @throws StructureException 节点属于某个网，且网中没有以新名字登记它。
     */
    public void rename(String newName) {
        Objects.requireNonNull(newName, "Node name cannot be null");
        if (net != null && !isRegisteredIn(net, newName)) {
            throw new StructureException("node '" + name + "' belongs to net '" + net.getName()
                    + "', rename it through the net");
        }
        this.name = newName;
    }

    /**
     * 记录所属的网，由 PetriNet 在登记或注销节点之后调用。
     * @param net 所属的网；null 表示不属于任何网。
     * @throws StructureException 节点已属于其他网、未在 net 中登记，或仍登记在原来的网中。
     */
    public void setNet(PetriNet net) {
        if (net != null) {
            if (this.net != null) {
                throw new StructureException("node '" + name + "' already belongs to net '" + this.net.getName() + "'");
            }
            if (!isRegisteredIn(net, name)) {
                throw new StructureException("node '" + name + "' is not registered in net '" + net.getName() + "'");
            }
        } else if (this.net != null && isRegisteredIn(this.net, name)) {
            throw new StructureException("node '" + name + "' is still registered in net '" + this.net.getName() + "'");
        }
        this.net = net;
    }

    private boolean isRegisteredIn(PetriNet candidate, String key) {
        return candidate.hasNode(key) && candidate.node(key) == this;
    }

    @Override
    public String toString() {
        return name;
    }
}
