package com.bucketvault.application.ports;

public interface CustodyTransaction {

    void commit();

    void rollback();
}
