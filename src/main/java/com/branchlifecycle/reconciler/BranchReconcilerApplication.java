package com.branchlifecycle.reconciler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BranchReconcilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BranchReconcilerApplication.class, args);
    }
}
