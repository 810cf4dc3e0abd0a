package me.x150.cctask;

import me.x150.cctask.build.BuildError;
import me.x150.cctask.build.BuildMatrixExecutor;
import me.x150.cctask.conf.descriptor.LoadedTask;
import me.x150.cctask.conf.descriptor.TaskDescriptorLoader;
import me.x150.cctask.env.EnvironmentSnapshot;
import me.x150.cctask.exc.ConfigurationException;
import me.x150.cctask.exec.LocalProcessRunner;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Mojo(name = "compile", defaultPhase = LifecyclePhase.COMPILE, threadSafe = true)
@SuppressWarnings("unused") // used by maven
public class CompileNativeMojo extends AbstractMojo {
	@Parameter(defaultValue = "${project}", readonly = true, required = true)
	MavenProject project;
	@Parameter(property = "cctask.descriptor", required = true)
	String descriptor;
	@Parameter(property = "cctask.clean", defaultValue = "false")
	boolean clean;
	@Parameter(property = "cctask.skip", defaultValue = "false")
	boolean skip;

	private void report(BuildMatrixExecutor executor, String what) throws MojoFailureException {
		for (BuildError error : executor.getErrors().entries()) {
			if (error.cause() != null) getLog().error(error.toString(), error.cause());
			else getLog().error(error.toString());
		}
		throw new MojoFailureException(what + " failed with " + executor.getErrors().size() + " error(s)");
	}

	@Override
	public void execute() throws MojoExecutionException, MojoFailureException {
		if (skip) {
			getLog().info("Skipping native compilation");
			return;
		}
		Path descPath = project.getBasedir().toPath().resolve(descriptor).normalize();
		if (!Files.isReadable(descPath)) {
			throw new MojoFailureException("Cannot read task descriptor at " + descPath);
		}

		LoadedTask task;
		try {
			task = new TaskDescriptorLoader().load(descPath);
		} catch (ConfigurationException e) {
			throw new MojoFailureException("Invalid task descriptor " + descPath + ": " + e.getMessage(), e);
		} catch (IOException e) {
			throw new MojoExecutionException("Could not read task descriptor " + descPath, e);
		}

		BuildMatrixExecutor executor = new BuildMatrixExecutor(task.toContext(new LocalProcessRunner(), EnvironmentSnapshot.current()));
		if (clean && !executor.clean(task.config())) report(executor, "Clean");

		getLog().info("Building " + task.config().getOutputFileName() + " with " + task.backend().name() + " for "
				+ task.request().configurations() + " x " + task.request().architectures());
		if (!executor.run(task.config(), task.request())) report(executor, "Native build");
	}
}
