/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package msp;

/**
 * Pairs the identifier of the provider that owns an identity with the local
 * identifier of that identity inside the provider.
 */
public final class IdentityIdentifier {

    private final String mspid;
    private final String id;

    public IdentityIdentifier(String mspid, String id) {

        this.mspid = mspid;
        this.id = id;
    }

    public String getMspid() {

        return mspid;
    }

    public String getId() {

        return id;
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 31 * hash + this.mspid.hashCode();
        hash = 31 * hash + this.id.hashCode();
        return hash;
    }

    @Override
    public boolean equals(Object o) {

        if (this == o) return true;
        if (o == null) return false;
        if (this.getClass() != o.getClass()) return false;
        IdentityIdentifier i = (IdentityIdentifier) o;
        return this.mspid.equals(i.mspid) && this.id.equals(i.id);
    }

    @Override
    public String toString(){

        return "[" + this.id + ":" + this.mspid + "]";
    }
}
