package dumb.tdfol.tableau;

/**
 * Frame conditions on the temporal accessibility relation.
 */
public enum ModalLogicType {
    K(false, false, false, false),
    T(true, false, false, false),
    D(false, true, false, false),
    S4(true, false, true, false),
    S5(true, false, true, true);

    public final boolean reflexive;
    public final boolean serial;
    public final boolean transitive;
    public final boolean symmetric;

    ModalLogicType(boolean reflexive, boolean serial, boolean transitive, boolean symmetric) {
        this.reflexive = reflexive;
        this.serial = serial;
        this.transitive = transitive;
        this.symmetric = symmetric;
    }
}
