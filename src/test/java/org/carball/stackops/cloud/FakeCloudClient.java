package org.carball.stackops.cloud;

import org.carball.stackops.exception.TransportException;
import org.carball.stackops.model.resource.FloatingIp;
import org.carball.stackops.model.resource.LoadBalancer;
import org.carball.stackops.model.resource.Project;
import org.carball.stackops.model.resource.Server;
import org.carball.stackops.model.resource.User;
import org.carball.stackops.model.resource.VolumeSnapshot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory cloud for tests. Listers return every stored resource regardless of the
 * native filters, which are recorded so tests can assert on what was pushed down.
 */
public class FakeCloudClient implements CloudClient {

    private final List<Server> servers = new ArrayList<>();
    private final List<FloatingIp> floatingIps = new ArrayList<>();
    private final List<LoadBalancer> loadBalancers = new ArrayList<>();
    private final List<VolumeSnapshot> volumeSnapshots = new ArrayList<>();
    private final Map<String, Project> projects = new LinkedHashMap<>();
    private final Map<String, User> users = new LinkedHashMap<>();
    private final List<Map<String, Object>> listingFilters = new ArrayList<>();
    private String failingLookupId;
    private boolean failListings;
    private int lookupCalls;

    public FakeCloudClient withServers(Server... added) {
        servers.addAll(Arrays.asList(added));
        return this;
    }

    public FakeCloudClient withFloatingIps(FloatingIp... added) {
        floatingIps.addAll(Arrays.asList(added));
        return this;
    }

    public FakeCloudClient withLoadBalancers(LoadBalancer... added) {
        loadBalancers.addAll(Arrays.asList(added));
        return this;
    }

    public FakeCloudClient withVolumeSnapshots(VolumeSnapshot... added) {
        volumeSnapshots.addAll(Arrays.asList(added));
        return this;
    }

    public FakeCloudClient withProjects(Project... added) {
        for (Project project : added) {
            projects.put(project.getId(), project);
        }
        return this;
    }

    public FakeCloudClient withUsers(User... added) {
        for (User user : added) {
            users.put(user.getId(), user);
        }
        return this;
    }

    public FakeCloudClient failingLookupFor(String id) {
        this.failingLookupId = id;
        return this;
    }

    public FakeCloudClient failingListings() {
        this.failListings = true;
        return this;
    }

    public List<Map<String, Object>> getListingFilters() {
        return listingFilters;
    }

    public int getLookupCalls() {
        return lookupCalls;
    }

    @Override
    public ResourceLister<Server> servers() {
        return filters -> record(filters, servers);
    }

    @Override
    public ResourceLister<FloatingIp> floatingIps() {
        return filters -> record(filters, floatingIps);
    }

    @Override
    public ResourceLister<LoadBalancer> loadBalancers() {
        return filters -> record(filters, loadBalancers);
    }

    @Override
    public ResourceLister<VolumeSnapshot> volumeSnapshots() {
        return filters -> record(filters, volumeSnapshots);
    }

    @Override
    public ResourceLister<Project> projects() {
        return filters -> record(filters, new ArrayList<>(projects.values()));
    }

    @Override
    public ResourceLister<User> users() {
        return filters -> record(filters, new ArrayList<>(users.values()));
    }

    @Override
    public AuxiliaryLookup<Project> projectLookup() {
        return id -> lookup(projects, id);
    }

    @Override
    public AuxiliaryLookup<User> userLookup() {
        return id -> lookup(users, id);
    }

    private <R> List<R> record(Map<String, Object> filters, List<R> resources) {
        if (failListings) {
            throw new TransportException("Connection refused");
        }
        listingFilters.add(filters);
        return new ArrayList<>(resources);
    }

    private <A> Optional<A> lookup(Map<String, A> store, String id) {
        lookupCalls++;
        if (id.equals(failingLookupId)) {
            throw new TransportException("Identity service unavailable");
        }
        return Optional.ofNullable(store.get(id));
    }
}
