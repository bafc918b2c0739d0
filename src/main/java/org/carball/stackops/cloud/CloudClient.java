package org.carball.stackops.cloud;

import org.carball.stackops.model.resource.FloatingIp;
import org.carball.stackops.model.resource.LoadBalancer;
import org.carball.stackops.model.resource.Project;
import org.carball.stackops.model.resource.Server;
import org.carball.stackops.model.resource.User;
import org.carball.stackops.model.resource.VolumeSnapshot;

/**
 * Everything the query engine needs from a cloud: a lister per resource type and
 * id lookups for the derived properties.
 */
public interface CloudClient {

    ResourceLister<Server> servers();

    ResourceLister<FloatingIp> floatingIps();

    ResourceLister<LoadBalancer> loadBalancers();

    ResourceLister<VolumeSnapshot> volumeSnapshots();

    ResourceLister<Project> projects();

    ResourceLister<User> users();

    AuxiliaryLookup<Project> projectLookup();

    AuxiliaryLookup<User> userLookup();
}
