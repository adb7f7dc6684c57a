package com.dvc.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "dvc.security")
public class SecurityProperties {

    private Map<String, Profile> profiles = new LinkedHashMap<>();

    public Map<String, Profile> getProfiles() {
        return profiles;
    }

    public void setProfiles(Map<String, Profile> profiles) {
        this.profiles = profiles;
    }

    public static class Profile {
        private List<String> capDrop = List.of("ALL");
        private List<String> capAdd = List.of();
        private boolean readOnlyRootfs = true;
        private Map<String, String> tmpfs = Map.of("/tmp", "rw,noexec,nosuid,size=100m");
        private String user = "1000:1000";
        private boolean noNewPrivileges = true;
        private boolean privileged = false;
        private int memoryMb = 512;
        private double cpus = 1.0;
        private int pidsLimit = 256;

        public List<String> getCapDrop() {
            return capDrop;
        }

        public void setCapDrop(List<String> capDrop) {
            this.capDrop = capDrop;
        }

        public List<String> getCapAdd() {
            return capAdd;
        }

        public void setCapAdd(List<String> capAdd) {
            this.capAdd = capAdd;
        }

        public boolean isReadOnlyRootfs() {
            return readOnlyRootfs;
        }

        public void setReadOnlyRootfs(boolean readOnlyRootfs) {
            this.readOnlyRootfs = readOnlyRootfs;
        }

        public Map<String, String> getTmpfs() {
            return tmpfs;
        }

        public void setTmpfs(Map<String, String> tmpfs) {
            this.tmpfs = tmpfs;
        }

        public String getUser() {
            return user;
        }

        public void setUser(String user) {
            this.user = user;
        }

        public boolean isNoNewPrivileges() {
            return noNewPrivileges;
        }

        public void setNoNewPrivileges(boolean noNewPrivileges) {
            this.noNewPrivileges = noNewPrivileges;
        }

        public boolean isPrivileged() {
            return privileged;
        }

        public void setPrivileged(boolean privileged) {
            this.privileged = privileged;
        }

        public int getMemoryMb() {
            return memoryMb;
        }

        public void setMemoryMb(int memoryMb) {
            this.memoryMb = memoryMb;
        }

        public double getCpus() {
            return cpus;
        }

        public void setCpus(double cpus) {
            this.cpus = cpus;
        }

        public int getPidsLimit() {
            return pidsLimit;
        }

        public void setPidsLimit(int pidsLimit) {
            this.pidsLimit = pidsLimit;
        }
    }
}
